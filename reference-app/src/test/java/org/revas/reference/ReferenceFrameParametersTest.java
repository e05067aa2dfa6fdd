package org.revas.reference;

import com.beust.jcommander.JCommander;

import java.util.Set;

import org.revas.reference.json.JsonUtils;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ReferenceFrameParameters} class.
 */
public class ReferenceFrameParametersTest {

    @Test
    public void testDefaults() {

        final ReferenceFrameParameters parameters = new ReferenceFrameParameters();
        parameters.validate();

        Assert.assertEquals("invalid default verbosity", Verbosity.NONE, parameters.verbosity);
        Assert.assertEquals("invalid default scale", 4, parameters.getScale());
        Assert.assertEquals("invalid default min peak", 0.75, parameters.minPeakThreshold, 0.0);
        Assert.assertEquals("invalid default max motion", 0.06, parameters.maxMotionThreshold, 0.0);
        Assert.assertTrue("strips should be enhanced by default", parameters.enhanceStrips);
        Assert.assertFalse("stabilized video should not be made by default", parameters.makeStabilizedVideo);
        Assert.assertEquals("strip height should default to upstream height", 12, parameters.resolveNewStripHeight(12));
        Assert.assertEquals("strip width should default to frame width", 512, parameters.resolveNewStripWidth(512));
    }

    @Test
    public void testCommandLineParsing() {

        final ReferenceFrameParameters parameters = new ReferenceFrameParameters();
        JCommander.newBuilder().addObject(parameters).build().parse(
                "--verbosity", "perFrame",
                "--subpixelExponent", "1",
                "--newStripHeight", "3",
                "--trimTop", "2",
                "--trimBottom", "5",
                "--enhanceStrips", "false",
                "--badFrame", "4", "7", "900",
                "--overwrite");
        parameters.validate();

        Assert.assertEquals("invalid verbosity", Verbosity.PER_FRAME, parameters.verbosity);
        Assert.assertEquals("invalid scale", 2, parameters.getScale());
        Assert.assertEquals("invalid strip height", 3, parameters.resolveNewStripHeight(12));
        Assert.assertEquals("invalid trim total", 7, parameters.getTrimTotal());
        Assert.assertFalse("enhanceStrips should be disabled", parameters.enhanceStrips);
        Assert.assertTrue("overwrite should be enabled", parameters.overwrite);

        final Set<Integer> badFrameSet = parameters.getBadFrameSet(100);
        Assert.assertEquals("out of range bad frames should be ignored", 2, badFrameSet.size());
        Assert.assertTrue("bad frame 7 is missing", badFrameSet.contains(7));
    }

    @Test
    public void testValidate() {
        validateAndExpectFailure("negative exponent", p -> p.subpixelExponent = -1);
        validateAndExpectFailure("peak above 1", p -> p.minPeakThreshold = 1.5);
        validateAndExpectFailure("NaN motion", p -> p.maxMotionThreshold = Double.NaN);
        validateAndExpectFailure("zero strip height", p -> p.newStripHeight = 0);
        validateAndExpectFailure("zero strip width", p -> p.newStripWidth = 0);
        validateAndExpectFailure("negative trim", p -> p.trimBottom = -2);
    }

    @Test
    public void testJsonProcessing() throws Exception {

        final ReferenceFrameParameters parameters = new ReferenceFrameParameters();
        parameters.verbosity = Verbosity.SUMMARY;
        parameters.newStripWidth = 128;

        final String json = JsonUtils.MAPPER.writeValueAsString(parameters);
        final ReferenceFrameParameters parsed = JsonUtils.MAPPER.readValue(json, ReferenceFrameParameters.class);

        Assert.assertEquals("invalid parsed verbosity", Verbosity.SUMMARY, parsed.verbosity);
        Assert.assertEquals("invalid parsed strip width", Integer.valueOf(128), parsed.newStripWidth);
        Assert.assertNull("unset strip height should stay unset", parsed.newStripHeight);
        Assert.assertTrue("toString should be json", parameters.toString().contains("\"newStripWidth\":128"));
    }

    private interface Change {
        void apply(ReferenceFrameParameters parameters);
    }

    private static void validateAndExpectFailure(final String context,
                                                 final Change change) {
        final ReferenceFrameParameters parameters = new ReferenceFrameParameters();
        change.apply(parameters);
        try {
            parameters.validate();
            Assert.fail(context + " should have been rejected");
        } catch (final ReferenceConfigurationException e) {
            Assert.assertNotNull(context + " should have a message", e.getMessage());
        }
    }

}
