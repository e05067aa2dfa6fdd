package org.revas.reference;

import com.beust.jcommander.Parameter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.revas.reference.json.JsonUtils;

/**
 * Parameters for building a reference frame from strip-registered video frames.
 */
public class ReferenceFrameParameters
        implements Serializable {

    public static final double DEFAULT_MIN_PEAK_THRESHOLD = 0.75;
    public static final double DEFAULT_MAX_MOTION_THRESHOLD = 0.06;
    public static final int DEFAULT_SUBPIXEL_EXPONENT = 2;
    public static final long DEFAULT_NOISE_SEED = 20200528L;

    @Parameter(
            names = "--overwrite",
            description = "Rebuild and replace an existing reference frame record " +
                          "(by default, an existing record is returned unchanged)")
    public boolean overwrite;

    @Parameter(
            names = "--verbosity",
            description = "Progress reporting level: none, summary, or perFrame",
            converter = Verbosity.Converter.class)
    public Verbosity verbosity;

    @Parameter(
            names = "--subpixelExponent",
            description = "Strips are placed at 2^subpixelExponent times the native resolution " +
                          "(0 means native resolution)")
    public Integer subpixelExponent;

    @Parameter(
            names = "--newStripHeight",
            description = "Height in pixels of the strips used to build the reference " +
                          "(omit to use the strip height of the motion trace)")
    public Integer newStripHeight;

    @Parameter(
            names = "--newStripWidth",
            description = "Width in pixels of the centered strip window (omit to use the full frame width)")
    public Integer newStripWidth;

    @Parameter(
            names = "--minPeakThreshold",
            description = "Minimum cross correlation peak value [0, 1] for a strip to be used")
    public Double minPeakThreshold;

    @Parameter(
            names = "--maxMotionThreshold",
            description = "Maximum motion between successive strips [0, 1] as a fraction of the frame height")
    public Double maxMotionThreshold;

    @Parameter(
            names = "--trimTop",
            description = "Number of rows removed from the top of each frame before strip analysis")
    public Integer trimTop;

    @Parameter(
            names = "--trimBottom",
            description = "Number of rows removed from the bottom of each frame before strip analysis")
    public Integer trimBottom;

    @Parameter(
            names = "--enhanceStrips",
            description = "Stretch the contrast of each strip before it is accumulated",
            arity = 1)
    public Boolean enhanceStrips;

    @Parameter(
            names = "--makeStabilizedVideo",
            description = "Also write a motion stabilized video with one frame per input frame")
    public boolean makeStabilizedVideo;

    @Parameter(
            names = "--badFrame",
            description = "0-based index of a blink or otherwise bad frame to skip (repeatable)",
            variableArity = true)
    public List<Integer> badFrames;

    @Parameter(
            names = "--noiseSeed",
            description = "Seed for the noise used to fill uncovered reference pixels")
    public Long noiseSeed;

    public ReferenceFrameParameters() {
        this.overwrite = false;
        this.makeStabilizedVideo = false;
        this.badFrames = new ArrayList<>();
        setDefaults();
    }

    public void setDefaults() {

        if (verbosity == null) {
            verbosity = Verbosity.NONE;
        }

        if (subpixelExponent == null) {
            subpixelExponent = DEFAULT_SUBPIXEL_EXPONENT;
        }

        if (minPeakThreshold == null) {
            minPeakThreshold = DEFAULT_MIN_PEAK_THRESHOLD;
        }

        if (maxMotionThreshold == null) {
            maxMotionThreshold = DEFAULT_MAX_MOTION_THRESHOLD;
        }

        if (trimTop == null) {
            trimTop = 0;
        }

        if (trimBottom == null) {
            trimBottom = 0;
        }

        if (enhanceStrips == null) {
            enhanceStrips = true;
        }

        if (badFrames == null) {
            badFrames = new ArrayList<>();
        }

        if (noiseSeed == null) {
            noiseSeed = DEFAULT_NOISE_SEED;
        }
    }

    /**
     * Fills in missing defaults and checks that all values are within their valid ranges.
     *
     * @throws ReferenceConfigurationException
     *   if any value is out of range.
     */
    public void validate()
            throws ReferenceConfigurationException {

        setDefaults();

        validateThreshold("minPeakThreshold", minPeakThreshold);
        validateThreshold("maxMotionThreshold", maxMotionThreshold);

        if (subpixelExponent < 0) {
            throw new ReferenceConfigurationException("subpixelExponent must be >= 0 but is " + subpixelExponent);
        }
        if ((newStripHeight != null) && (newStripHeight < 1)) {
            throw new ReferenceConfigurationException("newStripHeight must be > 0 but is " + newStripHeight);
        }
        if ((newStripWidth != null) && (newStripWidth < 1)) {
            throw new ReferenceConfigurationException("newStripWidth must be > 0 but is " + newStripWidth);
        }
        if ((trimTop < 0) || (trimBottom < 0)) {
            throw new ReferenceConfigurationException("trim values must be >= 0 but are top " + trimTop +
                                                      " and bottom " + trimBottom);
        }
    }

    @JsonIgnore
    public int getScale() {
        return 1 << subpixelExponent;
    }

    @JsonIgnore
    public int getTrimTotal() {
        return trimTop + trimBottom;
    }

    /**
     * @return the configured strip height or the upstream strip height when none was configured.
     */
    public int resolveNewStripHeight(final int oldStripHeight) {
        return newStripHeight == null ? oldStripHeight : newStripHeight;
    }

    /**
     * @return the configured strip width or the frame width when none was configured.
     */
    public int resolveNewStripWidth(final int frameWidth) {
        return newStripWidth == null ? frameWidth : newStripWidth;
    }

    /**
     * @return sorted set of configured bad frames that lie within [0, frameCount).
     */
    public Set<Integer> getBadFrameSet(final int frameCount) {
        return getBadFrameSet(frameCount, Collections.emptyList());
    }

    /**
     * @return sorted set of configured and additionally flagged bad frames that lie within [0, frameCount).
     */
    public Set<Integer> getBadFrameSet(final int frameCount,
                                       final Collection<Integer> flaggedBadFrames) {
        final Set<Integer> set = new TreeSet<>();
        for (final Integer badFrame : getAllBadFrames(flaggedBadFrames)) {
            if ((badFrame >= 0) && (badFrame < frameCount)) {
                set.add(badFrame);
            }
        }
        return set;
    }

    /**
     * @return distinct non-null configured and additionally flagged bad frames, in or out of range.
     */
    public Set<Integer> getAllBadFrames(final Collection<Integer> flaggedBadFrames) {
        final Set<Integer> set = new TreeSet<>();
        for (final Integer badFrame : badFrames) {
            if (badFrame != null) {
                set.add(badFrame);
            }
        }
        for (final Integer badFrame : flaggedBadFrames) {
            if (badFrame != null) {
                set.add(badFrame);
            }
        }
        return set;
    }

    @Override
    public String toString() {
        return JsonUtils.FAST_MAPPER.valueToTree(this).toString();
    }

    private static void validateThreshold(final String name,
                                          final Double value)
            throws ReferenceConfigurationException {
        if ((value == null) || Double.isNaN(value) || (value < 0.0) || (value > 1.0)) {
            throw new ReferenceConfigurationException(name + " must be between 0 and 1 but is " + value);
        }
    }

}
