package org.revas.reference;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.CancellationException;

import org.revas.reference.canvas.AccumulationCanvas;
import org.revas.reference.canvas.CanvasGeometry;
import org.revas.reference.canvas.StripPlacement;
import org.revas.reference.filter.BlackLineRemoval;
import org.revas.reference.filter.ContrastStretch;
import org.revas.reference.filter.Filter;
import org.revas.reference.motion.MotionSample;
import org.revas.reference.motion.ResampledTrace;
import org.revas.reference.util.ProcessTimer;
import org.revas.reference.video.FrameSource;
import org.revas.reference.video.StabilizedFrameSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places every strip of every good frame onto the accumulation canvas.
 *
 * Frames are visited in order and each frame is decoded once.  Usable strips with a defined position
 * are (optionally) contrast stretched and added to the canvas.  When a stabilized frame sink is provided,
 * all strips with a defined position, usable or not, are also accumulated into a per frame scratch canvas
 * that is normalized and written to the sink after the last strip of the frame.
 *
 * Cancellation is checked at each frame boundary.
 */
public class StripCompositor {

    /** Gray level of the placeholder frame written in place of a skipped frame. */
    public static final int PLACEHOLDER_VALUE = 255;

    private final CanvasGeometry geometry;
    private final ResampledTrace trace;
    private final int stripHeight;
    private final Set<Integer> badFrames;
    private final Filter stripFilter;
    private final Verbosity verbosity;

    private StabilizedFrameSink stabilizedFrameSink;
    private ProgressListener progressListener;
    private CancellationToken cancellationToken;

    /**
     * @param  geometry       canvas geometry.
     * @param  trace          strip positions at the new strip grid.
     * @param  stripHeight    height of each new strip in (unscaled) pixels.
     * @param  badFrames      0-based indexes of frames to skip.
     * @param  enhanceStrips  indicates whether strips should be contrast stretched before accumulation.
     * @param  verbosity      logging detail.
     */
    public StripCompositor(final CanvasGeometry geometry,
                           final ResampledTrace trace,
                           final int stripHeight,
                           final Set<Integer> badFrames,
                           final boolean enhanceStrips,
                           final Verbosity verbosity) {
        this.geometry = geometry;
        this.trace = trace;
        this.stripHeight = stripHeight;
        this.badFrames = badFrames;
        this.stripFilter = enhanceStrips ? new ContrastStretch() : null;
        this.verbosity = verbosity;
        this.stabilizedFrameSink = null;
        this.progressListener = null;
        this.cancellationToken = CancellationToken.NONE;
    }

    public StripCompositor withStabilizedFrameSink(final StabilizedFrameSink stabilizedFrameSink) {
        this.stabilizedFrameSink = stabilizedFrameSink;
        return this;
    }

    public StripCompositor withProgressListener(final ProgressListener progressListener) {
        this.progressListener = progressListener;
        return this;
    }

    public StripCompositor withCancellationToken(final CancellationToken cancellationToken) {
        this.cancellationToken = cancellationToken == null ? CancellationToken.NONE : cancellationToken;
        return this;
    }

    /**
     * Accumulates all frames of the source into the canvas.
     *
     * @return counts of processed frames and strips.
     *
     * @throws IOException
     *   if a frame cannot be decoded or a stabilized frame cannot be written.
     *
     * @throws CancellationException
     *   if the cancellation token is signaled before all frames have been processed.
     */
    public Statistics composite(final FrameSource frameSource,
                                final AccumulationCanvas canvas)
            throws IOException, CancellationException {

        final int frameCount = Math.min(frameSource.getFrameCount(), trace.getFrameCount());
        final AccumulationCanvas stabilizationCanvas =
                stabilizedFrameSink == null ? null : new AccumulationCanvas(canvas.getWidth(), canvas.getHeight());
        final BlackLineRemoval blackLineRemoval = BlackLineRemoval.forScale(geometry.getScale());

        final Statistics statistics = new Statistics();
        final ProcessTimer timer = new ProcessTimer();

        for (int frameIndex = 0; frameIndex < frameCount; frameIndex++) {

            if (cancellationToken.isCancelled()) {
                throw new CancellationException("strip composition cancelled before frame " + frameIndex +
                                                " of " + frameCount);
            }

            if (badFrames.contains(frameIndex)) {
                statistics.skippedFrameCount++;
                if (stabilizedFrameSink != null) {
                    stabilizedFrameSink.writeFrame(buildPlaceholderFrame(canvas));
                }
                if (verbosity.isAtLeast(Verbosity.PER_FRAME)) {
                    LOG.info("composite: skipped bad frame {}", frameIndex);
                }
                continue;
            }

            final ByteProcessor frame = frameSource.getFrame(frameIndex);
            if (stabilizationCanvas != null) {
                stabilizationCanvas.reset();
            }

            final int accumulatedBefore = statistics.accumulatedStripCount;
            for (int stripIndex = 0; stripIndex < trace.getStripsPerFrame(); stripIndex++) {
                addStrip(frame, frameIndex, stripIndex, canvas, stabilizationCanvas, statistics);
            }
            frame.resetRoi();
            statistics.processedFrameCount++;

            if (stabilizationCanvas != null) {
                stabilizedFrameSink.writeFrame(buildStabilizedFrame(stabilizationCanvas, blackLineRemoval));
            }

            if (verbosity.isAtLeast(Verbosity.PER_FRAME)) {
                LOG.info("composite: frame {} contributed {} of {} strips",
                         frameIndex, statistics.accumulatedStripCount - accumulatedBefore,
                         trace.getStripsPerFrame());
            } else if (verbosity.isAtLeast(Verbosity.SUMMARY) && timer.hasIntervalPassed()) {
                LOG.info("composite: processed {} of {} frames ({} frames per second)",
                         frameIndex + 1, frameCount, String.format("%.1f", timer.getRate(frameIndex + 1)));
            }

            if (progressListener != null) {
                progressListener.frameCompleted(frameIndex, canvas.getNormalizedProcessor());
            }
        }

        if (verbosity.isAtLeast(Verbosity.SUMMARY)) {
            LOG.info("composite: exit, {} after {}", statistics, timer);
        }

        return statistics;
    }

    /**
     * @return the band of the frame covered by the specified strip, cut to the strip column window
     *         and upsampled to the canvas scale.
     */
    public ImageProcessor extractStrip(final ImageProcessor frame,
                                       final int stripRow) {

        final int rowCount = Math.min(stripHeight, frame.getHeight() - stripRow);
        frame.setRoi(geometry.getStripLeft(), stripRow, geometry.getStripWidth(), rowCount);
        final ImageProcessor strip = frame.crop();

        final int scale = geometry.getScale();
        if (scale == 1) {
            return strip;
        }

        strip.setInterpolationMethod(ImageProcessor.BICUBIC);
        return strip.resize(strip.getWidth() * scale, strip.getHeight() * scale);
    }

    private void addStrip(final ImageProcessor frame,
                          final int frameIndex,
                          final int stripIndex,
                          final AccumulationCanvas canvas,
                          final AccumulationCanvas stabilizationCanvas,
                          final Statistics statistics) {

        final int stripRow = trace.getStripRow(stripIndex);
        final MotionSample sample = trace.getSample(frameIndex, stripIndex);
        final StripPlacement placement = geometry.getPlacement(sample, stripRow);

        statistics.processedStripCount++;

        final ImageProcessor strip = extractStrip(frame, stripRow);

        if ((stabilizationCanvas != null) && placement.isDefined()) {
            stabilizationCanvas.add(strip, placement);
        }

        if ((! sample.isUsable()) || (! placement.isDefined())) {
            return;
        }

        final ImageProcessor accumulatedStrip =
                stripFilter == null ? strip : stripFilter.process(strip, geometry.getScale());

        canvas.add(accumulatedStrip, placement);
        statistics.accumulatedStripCount++;
    }

    private static ByteProcessor buildPlaceholderFrame(final AccumulationCanvas canvas) {
        final ByteProcessor placeholder = new ByteProcessor(canvas.getWidth(), canvas.getHeight());
        placeholder.setValue(PLACEHOLDER_VALUE);
        placeholder.fill();
        return placeholder;
    }

    private static ByteProcessor buildStabilizedFrame(final AccumulationCanvas stabilizationCanvas,
                                                      final BlackLineRemoval blackLineRemoval) {
        final FloatProcessor normalized = stabilizationCanvas.getNormalizedProcessor();
        final FloatProcessor coverage = stabilizationCanvas.getCounterProcessor();
        blackLineRemoval.process(normalized, coverage);

        final float[] pixels = (float[]) normalized.getPixels();
        final byte[] quantized = new byte[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            quantized[i] = (byte) AccumulationCanvas.toByteRange(pixels[i]);
        }
        return new ByteProcessor(normalized.getWidth(), normalized.getHeight(), quantized);
    }

    /**
     * Counts of frames and strips seen by a composite run.
     */
    public static class Statistics {

        private int processedFrameCount;
        private int skippedFrameCount;
        private int processedStripCount;
        private int accumulatedStripCount;

        public int getProcessedFrameCount() {
            return processedFrameCount;
        }

        public int getSkippedFrameCount() {
            return skippedFrameCount;
        }

        public int getProcessedStripCount() {
            return processedStripCount;
        }

        public int getAccumulatedStripCount() {
            return accumulatedStripCount;
        }

        @Override
        public String toString() {
            return "processed " + processedFrameCount + " frames, skipped " + skippedFrameCount +
                   " bad frames, accumulated " + accumulatedStripCount + " of " + processedStripCount + " strips";
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StripCompositor.class);
}
