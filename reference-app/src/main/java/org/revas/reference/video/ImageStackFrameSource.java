package org.revas.reference.video;

import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

/**
 * Frames held in (or virtually backed by) an ImageJ stack.
 */
public class ImageStackFrameSource implements FrameSource {

    public static final double DEFAULT_FRAME_RATE = 30.0;

    private final ImageStack stack;
    private final double frameRate;

    public ImageStackFrameSource(final ImageStack stack) {
        this(stack, DEFAULT_FRAME_RATE);
    }

    public ImageStackFrameSource(final ImageStack stack,
                                 final double frameRate) {
        if ((stack == null) || (stack.getSize() == 0)) {
            throw new IllegalArgumentException("frame stack must contain at least one frame");
        }
        this.stack = stack;
        this.frameRate = frameRate;
    }

    @Override
    public int getFrameCount() {
        return stack.getSize();
    }

    @Override
    public int getWidth() {
        return stack.getWidth();
    }

    @Override
    public int getHeight() {
        return stack.getHeight();
    }

    @Override
    public double getFrameRate() {
        return frameRate;
    }

    @Override
    public ByteProcessor getFrame(final int frameIndex) {
        // ImageJ stack slices are 1-based
        final ImageProcessor ip = stack.getProcessor(frameIndex + 1);
        return ip instanceof ByteProcessor ? (ByteProcessor) ip : ip.convertToByteProcessor();
    }

    @Override
    public void close() {
    }

}
