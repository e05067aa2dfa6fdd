package org.revas.reference.video;

import ij.process.ByteProcessor;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sequential access to the single channel (8-bit) frames of a video.
 */
public interface FrameSource extends Closeable {

    int getFrameCount();

    int getWidth();

    int getHeight();

    /**
     * @return frames per second of the source (used to time stabilized output).
     */
    double getFrameRate();

    /**
     * @param  frameIndex  0-based frame index.
     *
     * @return 8-bit intensity pixels of the frame (colour frames are converted to gray).
     *
     * @throws IOException
     *   if the frame cannot be decoded.
     */
    ByteProcessor getFrame(final int frameIndex)
            throws IOException;

}
