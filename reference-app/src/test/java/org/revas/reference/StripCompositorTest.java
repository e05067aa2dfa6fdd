package org.revas.reference;

import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;

import org.revas.reference.canvas.AccumulationCanvas;
import org.revas.reference.canvas.CanvasGeometry;
import org.revas.reference.motion.ResampledTrace;
import org.revas.reference.video.ImageStackFrameSink;
import org.revas.reference.video.ImageStackFrameSource;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link StripCompositor} class.
 */
public class StripCompositorTest {

    private static final int FRAME_WIDTH = 8;
    private static final int FRAME_HEIGHT = 12;
    private static final int STRIP_HEIGHT = 4;

    @Test
    public void testBadFrameIsSkipped() throws Exception {

        final ImageStack stack = new ImageStack(FRAME_WIDTH, FRAME_HEIGHT);
        stack.addSlice("frame_0", buildFrame(10));
        stack.addSlice("frame_1", buildFrame(200));
        stack.addSlice("frame_2", buildFrame(30));

        final CanvasGeometry geometry = buildStationaryGeometry(1);
        final AccumulationCanvas canvas = new AccumulationCanvas(geometry.getWidth(), geometry.getHeight());
        final ImageStackFrameSink sink = new ImageStackFrameSink(geometry.getWidth(), geometry.getHeight());
        final List<Integer> completedFrames = new ArrayList<>();

        final StripCompositor compositor = new StripCompositor(geometry,
                                                               buildStationaryTrace(3, true),
                                                               STRIP_HEIGHT,
                                                               Collections.singleton(1),
                                                               false,
                                                               Verbosity.PER_FRAME)
                .withStabilizedFrameSink(sink)
                .withProgressListener((frameIndex, normalizedCanvas) -> completedFrames.add(frameIndex));

        final StripCompositor.Statistics statistics =
                compositor.composite(new ImageStackFrameSource(stack), canvas);

        Assert.assertEquals("invalid processed frame count", 2, statistics.getProcessedFrameCount());
        Assert.assertEquals("invalid skipped frame count", 1, statistics.getSkippedFrameCount());
        Assert.assertEquals("invalid processed strip count", 6, statistics.getProcessedStripCount());
        Assert.assertEquals("invalid accumulated strip count", 6, statistics.getAccumulatedStripCount());

        Assert.assertEquals("invalid count", 2, canvas.getCount(3, 5));
        Assert.assertEquals("bad frame should not contribute", 40.0, canvas.getSum(3, 5), 0.0);
        Assert.assertEquals("padding column should not be covered", 0, canvas.getCount(FRAME_WIDTH, 0));

        Assert.assertEquals("every frame should have a stabilized frame", 3, sink.getFrameCount());
        final ByteProcessor placeholder = sink.getFrame(1);
        for (int i = 0; i < placeholder.getPixelCount(); i++) {
            Assert.assertEquals("placeholder pixel " + i + " should be white",
                                StripCompositor.PLACEHOLDER_VALUE, placeholder.get(i));
        }
        Assert.assertEquals("invalid stabilized pixel for last frame", 30, sink.getFrame(2).get(2, 2));

        Assert.assertEquals("progress should be reported for decoded frames only",
                            2, completedFrames.size());
        Assert.assertEquals("invalid progress frame", Integer.valueOf(2), completedFrames.get(1));
    }

    @Test
    public void testUnusableStripsOnlyReachStabilizedFrames() throws Exception {

        final ImageStack stack = SyntheticVideo.buildUniformStack(FRAME_WIDTH, FRAME_HEIGHT, 2, 80);
        final CanvasGeometry geometry = buildStationaryGeometry(1);
        final AccumulationCanvas canvas = new AccumulationCanvas(geometry.getWidth(), geometry.getHeight());
        final ImageStackFrameSink sink = new ImageStackFrameSink(geometry.getWidth(), geometry.getHeight());

        final StripCompositor.Statistics statistics =
                new StripCompositor(geometry, buildStationaryTrace(2, false), STRIP_HEIGHT,
                                    new HashSet<>(), true, Verbosity.NONE)
                        .withStabilizedFrameSink(sink)
                        .composite(new ImageStackFrameSource(stack), canvas);

        Assert.assertEquals("no strip should be accumulated", 0, statistics.getAccumulatedStripCount());
        Assert.assertTrue("canvas should remain empty", canvas.isEmpty());
        Assert.assertEquals("stabilized frame should show unusable strips", 80, sink.getFrame(0).get(1, 1));
    }

    @Test
    public void testCancellation() throws Exception {

        final ImageStack stack = SyntheticVideo.buildUniformStack(FRAME_WIDTH, FRAME_HEIGHT, 3, 80);
        final CanvasGeometry geometry = buildStationaryGeometry(1);
        final AccumulationCanvas canvas = new AccumulationCanvas(geometry.getWidth(), geometry.getHeight());
        final CancellationToken cancellationToken = new CancellationToken();
        final Set<Integer> completedFrames = new HashSet<>();

        final StripCompositor compositor =
                new StripCompositor(geometry, buildStationaryTrace(3, true), STRIP_HEIGHT,
                                    new HashSet<>(), false, Verbosity.SUMMARY)
                        .withCancellationToken(cancellationToken)
                        .withProgressListener((frameIndex, normalizedCanvas) -> {
                            completedFrames.add(frameIndex);
                            cancellationToken.cancel();
                        });

        try {
            compositor.composite(new ImageStackFrameSource(stack), canvas);
            Assert.fail("composite should have been cancelled");
        } catch (final CancellationException e) {
            Assert.assertTrue("message should name the next frame, message is " + e.getMessage(),
                              e.getMessage().contains("frame 1"));
        }

        Assert.assertEquals("only the first frame should complete", 1, completedFrames.size());
    }

    @Test
    public void testExtractStrip() {

        final ByteProcessor frame = buildFrame(50);
        frame.set(4, 9, 250);

        final CanvasGeometry narrowGeometry = new CanvasGeometry(0, 0, 0, 0, 1, 8, 13, 2, 4);
        final StripCompositor narrowCompositor =
                new StripCompositor(narrowGeometry, buildStationaryTrace(1, true), STRIP_HEIGHT,
                                    new HashSet<>(), false, Verbosity.NONE);
        final ImageProcessor strip = narrowCompositor.extractStrip(frame, 8);

        Assert.assertEquals("invalid strip width", 4, strip.getWidth());
        Assert.assertEquals("invalid strip height", STRIP_HEIGHT, strip.getHeight());
        Assert.assertEquals("strip should start at the window column", 250, strip.get(2, 1));

        final CanvasGeometry scaledGeometry = buildStationaryGeometry(4);
        final StripCompositor scaledCompositor =
                new StripCompositor(scaledGeometry, buildStationaryTrace(1, true), STRIP_HEIGHT,
                                    new HashSet<>(), false, Verbosity.NONE);
        final ImageProcessor scaledStrip = scaledCompositor.extractStrip(buildFrame(50), 0);

        Assert.assertEquals("invalid scaled strip width", FRAME_WIDTH * 4, scaledStrip.getWidth());
        Assert.assertEquals("invalid scaled strip height", STRIP_HEIGHT * 4, scaledStrip.getHeight());
        Assert.assertEquals("uniform strip should stay uniform", 50, scaledStrip.get(9, 9));
    }

    @Test
    public void testProgressCanvasIsNormalized() throws Exception {

        final ImageStack stack = SyntheticVideo.buildUniformStack(FRAME_WIDTH, FRAME_HEIGHT, 2, 120);
        final CanvasGeometry geometry = buildStationaryGeometry(1);
        final AccumulationCanvas canvas = new AccumulationCanvas(geometry.getWidth(), geometry.getHeight());
        final List<FloatProcessor> snapshots = new ArrayList<>();

        new StripCompositor(geometry, buildStationaryTrace(2, true), STRIP_HEIGHT,
                            new HashSet<>(), false, Verbosity.NONE)
                .withProgressListener((frameIndex, normalizedCanvas) -> snapshots.add(normalizedCanvas))
                .composite(new ImageStackFrameSource(stack), canvas);

        Assert.assertEquals("invalid snapshot count", 2, snapshots.size());
        Assert.assertEquals("snapshot should hold averages", 120f, snapshots.get(1).getf(0, 0), 0f);
        Assert.assertTrue("uncovered snapshot pixel should be NaN",
                          Float.isNaN(snapshots.get(1).getf(FRAME_WIDTH, FRAME_HEIGHT)));
    }

    private static CanvasGeometry buildStationaryGeometry(final int scale) {
        return new CanvasGeometry(0, 0, 0, 0, scale,
                                  (FRAME_WIDTH + 1) * scale, (FRAME_HEIGHT + 1) * scale,
                                  0, FRAME_WIDTH);
    }

    private static ResampledTrace buildStationaryTrace(final int frameCount,
                                                       final boolean usable) {
        final int[] stripRows = { 0, 4, 8 };
        final int size = frameCount * stripRows.length;
        final double[] time = new double[size];
        final double[] x = new double[size];
        final double[] y = new double[size];
        final boolean[] usableFlags = new boolean[size];
        for (int i = 0; i < size; i++) {
            time[i] = i;
            usableFlags[i] = usable;
        }
        return new ResampledTrace(stripRows, frameCount, time, x, y, usableFlags);
    }

    private static ByteProcessor buildFrame(final int value) {
        final ByteProcessor frame = new ByteProcessor(FRAME_WIDTH, FRAME_HEIGHT);
        frame.setValue(value);
        frame.fill();
        return frame;
    }

}
