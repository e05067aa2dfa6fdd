package org.revas.reference.video;

import ij.ImagePlus;
import ij.VirtualStack;
import ij.io.FileSaver;
import ij.plugin.filter.AVI_Writer;
import ij.process.ByteProcessor;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

import org.revas.reference.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes stabilized frames to an uncompressed grayscale AVI file.
 *
 * Each frame is saved to a scratch TIFF file as soon as it is written, so no frame pixels are held in memory.
 * When the writer is closed, the scratch frames are streamed (through a virtual stack) into the AVI file
 * and then removed.
 */
public class AviStabilizedVideoWriter implements StabilizedFrameSink {

    private final File file;
    private final int width;
    private final int height;
    private final double frameRate;

    private File scratchDirectory;
    private int frameCount;
    private boolean released;

    public AviStabilizedVideoWriter(final File file,
                                    final int width,
                                    final int height,
                                    final double frameRate) {
        this.file = file.getAbsoluteFile();
        this.width = width;
        this.height = height;
        this.frameRate = frameRate;
        this.scratchDirectory = null;
        this.frameCount = 0;
        this.released = false;
    }

    public File getFile() {
        return file;
    }

    /**
     * @return directory holding frames written but not yet committed, or null if no frame has been written.
     */
    public File getScratchDirectory() {
        return scratchDirectory;
    }

    public int getFrameCount() {
        return frameCount;
    }

    @Override
    public void writeFrame(final ByteProcessor frame)
            throws IOException {

        if (released) {
            throw new IOException("cannot write frame to released writer for " + file.getAbsolutePath());
        }

        if ((frame.getWidth() != width) || (frame.getHeight() != height)) {
            throw new IllegalArgumentException(
                    "frame is " + frame.getWidth() + "x" + frame.getHeight() + " but " + width + "x" + height +
                    " is required for " + file.getAbsolutePath());
        }

        if (scratchDirectory == null) {
            scratchDirectory = Files.createTempDirectory(file.getParentFile().toPath(),
                                                         file.getName() + "_frames_").toFile();
            LOG.debug("writeFrame: saving frames to {}", scratchDirectory.getAbsolutePath());
        }

        final String frameName = getFrameName(frameCount);
        final File frameFile = new File(scratchDirectory, frameName);
        final FileSaver fileSaver = new FileSaver(new ImagePlus(frameName, frame));
        if (! fileSaver.saveAsTiff(frameFile.getAbsolutePath())) {
            throw new IOException("failed to save stabilized frame " + frameCount + " to " +
                                  frameFile.getAbsolutePath());
        }

        frameCount++;
    }

    @Override
    public void close()
            throws IOException {

        if (released) {
            return;
        }
        released = true;

        if (frameCount == 0) {
            LOG.warn("close: no frames were written, skipping creation of {}", file.getAbsolutePath());
            return;
        }

        final VirtualStack virtualStack =
                new VirtualStack(width, height, null, scratchDirectory.getAbsolutePath() + File.separator);
        for (int i = 0; i < frameCount; i++) {
            virtualStack.addSlice(getFrameName(i));
        }

        final ImagePlus imagePlus = new ImagePlus(file.getName(), virtualStack);
        imagePlus.getCalibration().fps = frameRate;

        try {
            new AVI_Writer().writeImage(imagePlus, file.getAbsolutePath(), AVI_Writer.NO_COMPRESSION, 0);
        } catch (final IOException e) {
            FileUtil.deleteIfExists(file);
            throw new IOException("failed to write stabilized video " + file.getAbsolutePath(), e);
        } finally {
            removeScratchFrames();
        }

        LOG.info("close: wrote {} frames to {}", frameCount, file.getAbsolutePath());
    }

    @Override
    public void discard() {
        released = true;
        removeScratchFrames();
        FileUtil.deleteIfExists(file);
    }

    private void removeScratchFrames() {
        if ((scratchDirectory != null) && scratchDirectory.exists()) {
            FileUtil.deleteRecursive(scratchDirectory);
        }
    }

    private static String getFrameName(final int frameIndex) {
        return String.format("frame_%06d.tif", frameIndex);
    }

    private static final Logger LOG = LoggerFactory.getLogger(AviStabilizedVideoWriter.class);
}
