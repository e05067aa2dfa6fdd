package org.revas.reference.motion;

import org.revas.reference.ReferenceConfigurationException;
import org.revas.reference.SyntheticVideo;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link PositionResampler} class.
 */
public class PositionResamplerTest {

    private static final double DT = SyntheticVideo.SECONDS_PER_SCAN_LINE;

    @Test
    public void testBuildStripRows() {
        Assert.assertArrayEquals("invalid rows for even split",
                                 new int[] { 0, 4, 8, 12 },
                                 new PositionResampler(16, 1, 4, 0, 0).buildStripRows());
        Assert.assertArrayEquals("rows should stop before a partial strip",
                                 new int[] { 0, 5, 10 },
                                 new PositionResampler(16, 1, 5, 0, 0).buildStripRows());
        Assert.assertArrayEquals("full height strip should give one row",
                                 new int[] { 0 },
                                 new PositionResampler(16, 1, 16, 0, 0).buildStripRows());
    }

    @Test
    public void testResampleToFinerStrips() {

        // samples at rows 0 and 8 of 2 frames moving 1 pixel to the right per strip
        final MotionTrace trace = SyntheticVideo.buildTrace(16, 2, 8, 1.0, 0.0);
        final StripQualityFilter.Result quality = new StripQualityFilter(0.0, 1.0).evaluate(trace, 16, 2);

        final ResampledTrace resampled = new PositionResampler(16, 2, 4, 0, 0).resample(trace, quality);

        Assert.assertEquals("invalid strips per frame", 4, resampled.getStripsPerFrame());
        Assert.assertEquals("invalid size", 8, resampled.size());

        for (int i = 1; i < resampled.size(); i++) {
            Assert.assertTrue("times should increase at sample " + i,
                              resampled.getTime(i) > resampled.getTime(i - 1));
        }
        Assert.assertEquals("invalid time for second frame", 16 * DT, resampled.getTime(4), 0.0);

        Assert.assertEquals("invalid interpolated x", 0.5, resampled.getX(1), 1e-12);
        Assert.assertEquals("invalid x at sample time", 2.0, resampled.getX(4), 1e-12);
        Assert.assertTrue("sample before the last strip should be usable", resampled.isUsable(6));

        Assert.assertTrue("x after the last sample should be NaN", Double.isNaN(resampled.getX(7)));
        Assert.assertFalse("strip after the last sample should not be usable", resampled.isUsable(7));
        Assert.assertFalse("undefined sample should not have a position",
                           resampled.getSample(1, 3).hasDefinedPosition());
    }

    @Test
    public void testUsabilityThreshold() {

        final MotionTrace trace = SyntheticVideo.buildTrace(16, 2, 8, 1.0, 0.0);
        final StripQualityFilter.Result quality = new StripQualityFilter.Result(new double[4],
                                                                                new boolean[] {
                                                                                        true, false, true, true
                                                                                },
                                                                                3);

        final ResampledTrace resampled = new PositionResampler(16, 2, 4, 0, 0).resample(trace, quality);

        // interpolated usability: 1, 0.5, 0, 0.5, 1, 1, 1 (then outside the sampled range)
        final boolean[] expected = { true, false, false, false, true, true, true, false };
        for (int i = 0; i < expected.length; i++) {
            Assert.assertEquals("invalid usability for sample " + i, expected[i], resampled.isUsable(i));
        }

        Assert.assertEquals("position should skip the unusable sample", 1.0, resampled.getX(2), 1e-12);
        Assert.assertEquals("invalid usable count", 4, resampled.getUsableCount());
    }

    @Test
    public void testSingleStripTemplateWithTrim() {

        final MotionTrace trace = new MotionTrace(new double[] { 0.0, 20 * DT, 40 * DT },
                                                  new double[][] { {0, 0}, {0, 2}, {0, 4} },
                                                  new double[] { 1, 1, 1 },
                                                  new int[] { 0 },
                                                  16);
        final StripQualityFilter.Result quality = new StripQualityFilter(0.0, 1.0).evaluate(trace, 16, 3);

        final ResampledTrace resampled = new PositionResampler(16, 3, 8, 3, 1).resample(trace, quality);

        Assert.assertEquals("invalid size", 6, resampled.size());
        Assert.assertEquals("invalid time for second strip", 8 * DT, resampled.getTime(1), 0.0);
        Assert.assertEquals("invalid time for second frame", 20 * DT, resampled.getTime(2), 0.0);
        Assert.assertEquals("invalid y for second strip", 0.8, resampled.getY(1), 1e-12);
    }

    @Test
    public void testInvalidStripHeight() {
        for (final int newStripHeight : new int[] { 0, 17 }) {
            try {
                new PositionResampler(16, 1, newStripHeight, 0, 0);
                Assert.fail("strip height " + newStripHeight + " should have been rejected");
            } catch (final ReferenceConfigurationException e) {
                Assert.assertTrue("message should mention newStripHeight",
                                  e.getMessage().contains("newStripHeight"));
            }
        }
    }

    @Test(expected = ReferenceConfigurationException.class)
    public void testDecreasingTimes() {
        final MotionTrace trace = new MotionTrace(new double[] { 1.0, 0.5 },
                                                  new double[][] { {0, 0}, {0, 0} },
                                                  new double[] { 1, 1 },
                                                  new int[] { 0, 8 },
                                                  8);
        final StripQualityFilter.Result quality = new StripQualityFilter(0.0, 1.0).evaluate(trace, 16, 1);
        new PositionResampler(16, 1, 8, 0, 0).resample(trace, quality);
    }

}
