package org.revas.reference.motion;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.revas.reference.ReferenceConfigurationException;
import org.revas.reference.json.JsonUtils;

/**
 * Strip motion estimated by the upstream strip analysis.
 *
 * Samples are stored frame-major (all strips of the first frame, then all strips of the second frame, ...).
 * Each sample has a time stamp, the (x, y) offset of its strip and the cross correlation peak value of the match.
 * The row template lists the 0-based first row of each analyzed strip within a frame.
 * Frames flagged upstream (e.g. blinks) may be listed as 0-based bad frame indexes.
 */
public class MotionTrace
        implements Serializable {

    private double[] timeSec;
    private double[][] position;
    private double[] peakValue;
    private int[] rowNumbers;
    private Integer oldStripHeight;
    private List<Integer> badFrames;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private MotionTrace() {
    }

    public MotionTrace(final double[] timeSec,
                       final double[][] position,
                       final double[] peakValue,
                       final int[] rowNumbers,
                       final Integer oldStripHeight) {
        this(timeSec, position, peakValue, rowNumbers, oldStripHeight, null);
    }

    public MotionTrace(final double[] timeSec,
                       final double[][] position,
                       final double[] peakValue,
                       final int[] rowNumbers,
                       final Integer oldStripHeight,
                       final List<Integer> badFrames) {
        this.timeSec = timeSec;
        this.position = position;
        this.peakValue = peakValue;
        this.rowNumbers = rowNumbers;
        this.oldStripHeight = oldStripHeight;
        this.badFrames = badFrames;
    }

    @JsonIgnore
    public int size() {
        return timeSec == null ? 0 : timeSec.length;
    }

    public double getTime(final int index) {
        return timeSec[index];
    }

    public double getX(final int index) {
        return position[index][0];
    }

    public double getY(final int index) {
        return position[index][1];
    }

    public double getPeakValue(final int index) {
        return peakValue[index];
    }

    public int[] getRowNumbers() {
        return rowNumbers;
    }

    public Integer getOldStripHeight() {
        return oldStripHeight;
    }

    /**
     * @return bad frames flagged by the upstream analysis (empty if none were flagged).
     */
    public List<Integer> getBadFrames() {
        return badFrames == null ? Collections.emptyList() : badFrames;
    }

    public MotionSample getSample(final int index,
                                  final boolean usable) {
        return new MotionSample(timeSec[index], getX(index), getY(index), peakValue[index], usable);
    }

    /**
     * @throws ReferenceConfigurationException
     *   if the strip geometry is missing or the sample arrays are inconsistent.
     */
    public void validate()
            throws ReferenceConfigurationException {

        if ((oldStripHeight == null) || (oldStripHeight < 1)) {
            throw new ReferenceConfigurationException("motion trace is missing a positive oldStripHeight");
        }
        if ((rowNumbers == null) || (rowNumbers.length == 0)) {
            throw new ReferenceConfigurationException("motion trace is missing the strip rowNumbers template");
        }
        if ((timeSec == null) || (position == null) || (peakValue == null)) {
            throw new ReferenceConfigurationException("motion trace must define timeSec, position, and peakValue");
        }
        if ((position.length != timeSec.length) || (peakValue.length != timeSec.length)) {
            throw new ReferenceConfigurationException(
                    "motion trace arrays have different lengths: " + timeSec.length + " time values, " +
                    position.length + " positions, " + peakValue.length + " peak values");
        }
        if (timeSec.length < 2) {
            throw new ReferenceConfigurationException("motion trace must contain at least 2 samples");
        }
        for (int i = 0; i < position.length; i++) {
            if ((position[i] == null) || (position[i].length != 2)) {
                throw new ReferenceConfigurationException("position " + i + " must contain exactly 2 values (x, y)");
            }
        }
    }

    /**
     * Removes repeated time stamps since interpolation is undefined on repeated abscissas.
     * When two consecutive samples share a time stamp, the earlier one is dropped.
     *
     * @return this trace if it has no duplicates, otherwise a filtered copy.
     */
    public MotionTrace withoutDuplicateTimestamps() {

        final List<Integer> keptIndexes = new ArrayList<>(timeSec.length);
        for (int i = 0; i < timeSec.length; i++) {
            final boolean isLast = (i == timeSec.length - 1);
            if (isLast || (timeSec[i + 1] != timeSec[i])) {
                keptIndexes.add(i);
            }
        }

        if (keptIndexes.size() == timeSec.length) {
            return this;
        }

        final double[] keptTime = new double[keptIndexes.size()];
        final double[][] keptPosition = new double[keptIndexes.size()][];
        final double[] keptPeak = new double[keptIndexes.size()];
        for (int k = 0; k < keptIndexes.size(); k++) {
            final int i = keptIndexes.get(k);
            keptTime[k] = timeSec[i];
            keptPosition[k] = position[i];
            keptPeak[k] = peakValue[i];
        }

        return new MotionTrace(keptTime, keptPosition, keptPeak, rowNumbers, oldStripHeight, badFrames);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static MotionTrace fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<MotionTrace> JSON_HELPER =
            new JsonUtils.Helper<>(MotionTrace.class);
}
