package org.revas.reference.video;

import ij.ImageStack;
import ij.process.ByteProcessor;

/**
 * Collects stabilized frames in memory.
 */
public class ImageStackFrameSink implements StabilizedFrameSink {

    private final int width;
    private final int height;
    private ImageStack stack;
    private boolean closed;

    public ImageStackFrameSink(final int width,
                               final int height) {
        this.width = width;
        this.height = height;
        this.stack = new ImageStack(width, height);
        this.closed = false;
    }

    @Override
    public void writeFrame(final ByteProcessor frame) {
        if (closed) {
            throw new IllegalStateException("cannot write to a closed sink");
        }
        if ((frame.getWidth() != width) || (frame.getHeight() != height)) {
            throw new IllegalArgumentException("frame is " + frame.getWidth() + "x" + frame.getHeight() +
                                               " but sink expects " + width + "x" + height);
        }
        stack.addSlice("frame_" + stack.getSize(), frame);
    }

    @Override
    public void discard() {
        stack = new ImageStack(width, height);
        closed = true;
    }

    @Override
    public void close() {
        closed = true;
    }

    public ImageStack getStack() {
        return stack;
    }

    public int getFrameCount() {
        return stack.getSize();
    }

    public ByteProcessor getFrame(final int frameIndex) {
        return (ByteProcessor) stack.getProcessor(frameIndex + 1);
    }

}
