package org.revas.reference.filter;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ContrastStretch} class.
 */
public class ContrastStretchTest {

    @Test
    public void testStretch() {

        final ByteProcessor ramp = new ByteProcessor(10, 10);
        for (int i = 0; i < ramp.getPixelCount(); i++) {
            ramp.set(i, 50 + i);
        }

        final ImageProcessor stretched = new ContrastStretch().process(ramp, 1.0);

        Assert.assertEquals("darkest pixel should saturate", 0, stretched.get(0));
        Assert.assertEquals("low limit should map to 0", 0, stretched.get(1));
        Assert.assertEquals("high limit should map to 255", 255, stretched.get(98));
        Assert.assertEquals("brightest pixel should saturate", 255, stretched.get(99));

        for (int i = 2; i < 98; i++) {
            Assert.assertTrue("stretch should preserve order at pixel " + i,
                              stretched.get(i) >= stretched.get(i - 1));
        }
    }

    @Test
    public void testFindLimits() {
        final int[] histogram = new int[256];
        histogram[10] = 1;
        histogram[20] = 98;
        histogram[200] = 1;

        Assert.assertArrayEquals("outliers should be excluded from the limits",
                                 new int[] { 20, 20 },
                                 ContrastStretch.findLimits(histogram, 100, 0.01));
        Assert.assertArrayEquals("without saturation the limits should span all values",
                                 new int[] { 10, 200 },
                                 ContrastStretch.findLimits(histogram, 100, 0.0));
    }

    @Test
    public void testUniformStripIsUnchanged() {
        final ByteProcessor uniform = new ByteProcessor(8, 4);
        uniform.setValue(77);
        uniform.fill();

        final ImageProcessor result = new ContrastStretch().process(uniform, 2.0);

        for (int i = 0; i < result.getPixelCount(); i++) {
            Assert.assertEquals("uniform pixel " + i + " should not change", 77, result.get(i));
        }
    }

    @Test
    public void testFloatInputIsConvertedWithoutScaling() {
        final FloatProcessor fp = new FloatProcessor(4, 1, new float[] { 100f, 100f, 100f, 100f });

        final ImageProcessor result = new ContrastStretch().process(fp, 1.0);

        Assert.assertTrue("result should be 8-bit", result instanceof ByteProcessor);
        Assert.assertEquals("value should not be rescaled", 100, result.get(0));
    }

    @Test
    public void testSaturatedFraction() {

        final ByteProcessor ramp = new ByteProcessor(100, 1);
        for (int x = 0; x < 100; x++) {
            ramp.set(x, 0, 10 + x);
        }

        final ImageProcessor unsaturated = new ContrastStretch(0.0).process(ramp.duplicate(), 1.0);
        Assert.assertEquals("darkest pixel should map to 0", 0, unsaturated.get(0));
        Assert.assertEquals("brightest pixel should map to 255", 255, unsaturated.get(99));
        Assert.assertTrue("intermediate pixel should not saturate", unsaturated.get(5) > 0);

        final ImageProcessor saturated = new ContrastStretch(0.1).process(ramp.duplicate(), 1.0);
        Assert.assertEquals("dark tail should saturate at 0", 0, saturated.get(5));
        Assert.assertEquals("bright tail should saturate at 255", 255, saturated.get(95));
        Assert.assertTrue("pixel inside limits should not saturate", saturated.get(50) > 0);
        Assert.assertTrue("pixel inside limits should not saturate", saturated.get(50) < 255);
    }

}
