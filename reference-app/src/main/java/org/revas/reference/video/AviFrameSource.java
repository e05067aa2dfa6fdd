package org.revas.reference.video;

import ij.ImagePlus;
import ij.ImageStack;
import ij.plugin.AVI_Reader;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads frames from an uncompressed or MJPEG AVI file through a virtual ImageJ stack,
 * so frames are decoded only when they are requested.
 */
public class AviFrameSource implements FrameSource {

    private final String path;
    private ImagePlus imagePlus;
    private ImageStack stack;

    public AviFrameSource(final String path)
            throws IOException {

        final File file = new File(path);
        if (! file.canRead()) {
            throw new IOException("cannot read video " + file.getAbsolutePath());
        }

        this.path = file.getAbsolutePath();
        this.imagePlus = AVI_Reader.open(this.path, true);

        if ((imagePlus == null) || (imagePlus.getStackSize() == 0)) {
            throw new IOException("failed to open video " + this.path);
        }

        this.stack = imagePlus.getStack();

        LOG.info("AviFrameSource: opened {} with {} {}x{} frames at {} fps",
                 this.path, stack.getSize(), stack.getWidth(), stack.getHeight(), getFrameRate());
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
        final double fps = imagePlus.getCalibration().fps;
        return fps > 0 ? fps : ImageStackFrameSource.DEFAULT_FRAME_RATE;
    }

    @Override
    public ByteProcessor getFrame(final int frameIndex)
            throws IOException {

        final ImageProcessor ip;
        try {
            ip = stack.getProcessor(frameIndex + 1);
        } catch (final Throwable t) {
            throw new IOException("failed to decode frame " + frameIndex + " of " + path, t);
        }

        if (ip == null) {
            throw new IOException("failed to decode frame " + frameIndex + " of " + path);
        }

        return ip instanceof ByteProcessor ? (ByteProcessor) ip : ip.convertToByteProcessor();
    }

    @Override
    public void close() {
        if (imagePlus != null) {
            imagePlus.close();
            imagePlus = null;
            stack = null;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AviFrameSource.class);
}
