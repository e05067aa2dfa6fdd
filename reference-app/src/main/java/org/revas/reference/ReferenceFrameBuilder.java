package org.revas.reference;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.CancellationException;

import org.revas.reference.canvas.AccumulationCanvas;
import org.revas.reference.canvas.CanvasAllocator;
import org.revas.reference.canvas.CanvasGeometry;
import org.revas.reference.motion.MotionTrace;
import org.revas.reference.motion.PositionResampler;
import org.revas.reference.motion.ResampledTrace;
import org.revas.reference.motion.StripQualityFilter;
import org.revas.reference.util.ProcessTimer;
import org.revas.reference.video.FrameSource;
import org.revas.reference.video.StabilizedFrameSink;
import org.revas.reference.video.StabilizedFrameSinkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a reference frame from a video and the strip motion estimated for it.
 *
 * <pre>
 *   motion trace  -&gt;  quality filter  -&gt;  position resampler  -&gt;  canvas allocator
 *                 -&gt;  strip compositor (frames)  -&gt;  post processor  -&gt;  reference frame
 * </pre>
 */
public class ReferenceFrameBuilder {

    private final ReferenceFrameParameters parameters;
    private ProgressListener progressListener;
    private CancellationToken cancellationToken;

    public ReferenceFrameBuilder(final ReferenceFrameParameters parameters)
            throws ReferenceConfigurationException {
        parameters.validate();
        this.parameters = parameters;
        this.progressListener = null;
        this.cancellationToken = CancellationToken.NONE;
    }

    public ReferenceFrameBuilder withProgressListener(final ProgressListener progressListener) {
        this.progressListener = progressListener;
        return this;
    }

    public ReferenceFrameBuilder withCancellationToken(final CancellationToken cancellationToken) {
        this.cancellationToken = cancellationToken;
        return this;
    }

    public ReferenceFrame build(final MotionTrace motionTrace,
                                final FrameSource frameSource)
            throws IOException, CancellationException {
        return build(motionTrace, frameSource, null);
    }

    /**
     * @param  motionTrace   upstream strip motion for the video.
     * @param  frameSource   video frames (the caller remains responsible for closing it).
     * @param  sinkFactory   creates the stabilized video sink, required when stabilized video was requested
     *                       and ignored otherwise.
     *                       The sink is always released before this method returns and is discarded on failure.
     *
     * @return the reference frame (not yet persisted).
     *
     * @throws ReferenceConfigurationException
     *   if the motion trace is incomplete or inconsistent with the video,
     *   or if stabilized video was requested without a sink factory.
     *
     * @throws DegenerateMotionException
     *   if no strip is usable.
     *
     * @throws IOException
     *   if frames cannot be read or stabilized frames cannot be written.
     *
     * @throws CancellationException
     *   if the build was cancelled.
     */
    public ReferenceFrame build(final MotionTrace motionTrace,
                                final FrameSource frameSource,
                                final StabilizedFrameSinkFactory sinkFactory)
            throws IOException, CancellationException {

        final ProcessTimer timer = new ProcessTimer();
        final boolean logSummary = parameters.verbosity.isAtLeast(Verbosity.SUMMARY);

        if (logSummary) {
            LOG.info("build: entry, parameters={}", parameters);
        }

        if (parameters.makeStabilizedVideo && (sinkFactory == null)) {
            throw new ReferenceConfigurationException("stabilized video was requested but no sink was provided");
        }

        motionTrace.validate();
        final MotionTrace trace = motionTrace.withoutDuplicateTimestamps();
        if (trace.size() < 2) {
            throw new ReferenceConfigurationException("motion trace has fewer than 2 distinct time stamps");
        }
        if (logSummary && (trace.size() < motionTrace.size())) {
            LOG.info("build: removed {} samples with duplicate time stamps", motionTrace.size() - trace.size());
        }

        final int frameCount = frameSource.getFrameCount();
        final int frameWidth = frameSource.getWidth();
        final int frameHeight = frameSource.getHeight();

        final Set<Integer> requestedBadFrames = parameters.getAllBadFrames(trace.getBadFrames());
        final Set<Integer> badFrames = parameters.getBadFrameSet(frameCount, trace.getBadFrames());
        if (badFrames.size() < requestedBadFrames.size()) {
            LOG.warn("build: ignoring {} bad frame indexes outside of [0, {})",
                     requestedBadFrames.size() - badFrames.size(), frameCount);
        }

        final StripQualityFilter qualityFilter = new StripQualityFilter(parameters.minPeakThreshold,
                                                                        parameters.maxMotionThreshold);
        final StripQualityFilter.Result quality = qualityFilter.evaluate(trace, frameHeight, frameCount);
        if (! quality.hasUsableSamples()) {
            throw new DegenerateMotionException("none of the " + trace.size() + " strips passed the quality " +
                                                "filter (minPeakThreshold " + parameters.minPeakThreshold +
                                                ", maxMotionThreshold " + parameters.maxMotionThreshold + ")");
        }

        final int newStripHeight = parameters.resolveNewStripHeight(trace.getOldStripHeight());
        final int newStripWidth = parameters.resolveNewStripWidth(frameWidth);

        final PositionResampler resampler = new PositionResampler(frameHeight,
                                                                  frameCount,
                                                                  newStripHeight,
                                                                  parameters.trimTop,
                                                                  parameters.trimBottom);
        final ResampledTrace resampledTrace = resampler.resample(trace, quality);

        final CanvasAllocator allocator = new CanvasAllocator(parameters.subpixelExponent,
                                                              frameWidth,
                                                              frameHeight,
                                                              newStripWidth);
        final CanvasGeometry geometry = allocator.buildGeometry(trace, quality);
        final AccumulationCanvas canvas = allocator.allocate(geometry);

        if (logSummary) {
            LOG.info("build: {} of {} strips are usable, resampled to {} strips of height {} with {} usable, " +
                     "canvas geometry is {}",
                     quality.getUsableCount(), trace.size(), resampledTrace.size(), newStripHeight,
                     resampledTrace.getUsableCount(), geometry);
        }

        final StripCompositor compositor = new StripCompositor(geometry,
                                                               resampledTrace,
                                                               newStripHeight,
                                                               badFrames,
                                                               parameters.enhanceStrips,
                                                               parameters.verbosity)
                .withProgressListener(progressListener)
                .withCancellationToken(cancellationToken);

        final StripCompositor.Statistics statistics;
        if (parameters.makeStabilizedVideo) {
            statistics = compositeWithStabilizedVideo(compositor, frameSource, canvas, sinkFactory);
        } else {
            statistics = compositor.composite(frameSource, canvas);
        }

        final ReferenceFramePostProcessor postProcessor =
                new ReferenceFramePostProcessor(geometry.getScale(), parameters.noiseSeed);
        final ReferenceFramePostProcessor.Result result = postProcessor.process(canvas);

        final ReferenceFrame referenceFrame = new ReferenceFrame(result.getReference(),
                                                                 result.getReferenceFloat(),
                                                                 parameters,
                                                                 null,
                                                                 quality.getUsableCount(),
                                                                 statistics.getAccumulatedStripCount());

        if (logSummary) {
            LOG.info("build: exit, built {} in {}", referenceFrame, timer);
        }

        return referenceFrame;
    }

    private StripCompositor.Statistics compositeWithStabilizedVideo(final StripCompositor compositor,
                                                                    final FrameSource frameSource,
                                                                    final AccumulationCanvas canvas,
                                                                    final StabilizedFrameSinkFactory sinkFactory)
            throws IOException {

        final StabilizedFrameSink sink = sinkFactory.create(canvas.getWidth(),
                                                            canvas.getHeight(),
                                                            frameSource.getFrameRate());
        final StripCompositor.Statistics statistics;
        try {
            statistics = compositor.withStabilizedFrameSink(sink).composite(frameSource, canvas);
        } catch (final IOException | RuntimeException e) {
            sink.discard();
            throw e;
        }

        sink.close();

        return statistics;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceFrameBuilder.class);
}
