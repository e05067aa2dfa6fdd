package org.revas.reference.video;

import ij.process.ByteProcessor;

import java.io.Closeable;
import java.io.IOException;

/**
 * Receives one motion stabilized frame per input frame, in frame order.
 *
 * {@link #close()} commits everything written so far.  {@link #discard()} releases the sink
 * without committing and removes anything already persisted.
 */
public interface StabilizedFrameSink extends Closeable {

    void writeFrame(final ByteProcessor frame)
            throws IOException;

    void discard();

}
