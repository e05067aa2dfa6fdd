package org.revas.reference.video;

import java.io.IOException;

/**
 * Creates the stabilized frame sink once the canvas size of a build is known.
 */
public interface StabilizedFrameSinkFactory {

    StabilizedFrameSink create(final int width,
                               final int height,
                               final double frameRate)
            throws IOException;

}
