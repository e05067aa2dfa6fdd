package org.revas.reference.motion;

import java.util.Arrays;

import org.revas.reference.ReferenceConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-projects a motion trace analyzed with one strip height onto a (typically finer) strip grid.
 *
 * New strip time stamps are derived from the per scan line time delta of the first two samples.
 * Usability is interpolated as a 0/1 signal and thresholded at 0.5.
 * Positions are interpolated from usable samples only and are NaN outside their time range.
 */
public class PositionResampler {

    private final int frameHeight;
    private final int frameCount;
    private final int newStripHeight;
    private final int trimTotal;

    public PositionResampler(final int frameHeight,
                             final int frameCount,
                             final int newStripHeight,
                             final int trimTop,
                             final int trimBottom)
            throws ReferenceConfigurationException {

        if (newStripHeight < 1) {
            throw new ReferenceConfigurationException("newStripHeight must be > 0 but is " + newStripHeight);
        }
        if (newStripHeight > frameHeight) {
            throw new ReferenceConfigurationException("newStripHeight " + newStripHeight +
                                                      " exceeds the frame height " + frameHeight);
        }

        this.frameHeight = frameHeight;
        this.frameCount = frameCount;
        this.newStripHeight = newStripHeight;
        this.trimTotal = trimTop + trimBottom;
    }

    /**
     * @return 0-based first row of each new strip within a frame.
     */
    public int[] buildStripRows() {
        final int stripsPerFrame = ((frameHeight - newStripHeight) / newStripHeight) + 1;
        final int[] rows = new int[stripsPerFrame];
        for (int i = 0; i < stripsPerFrame; i++) {
            rows[i] = i * newStripHeight;
        }
        return rows;
    }

    /**
     * @param  trace    motion trace without duplicate time stamps.
     * @param  quality  usability of each trace sample.
     *
     * @return trace resampled at the new strip grid.
     */
    public ResampledTrace resample(final MotionTrace trace,
                                   final StripQualityFilter.Result quality)
            throws ReferenceConfigurationException {

        final int[] stripRows = buildStripRows();
        final double dtPerScanLine = getTimePerScanLine(trace);
        final double rowsPerFrame = trimTotal + frameHeight;

        final int newSampleCount = frameCount * stripRows.length;
        final double[] newTime = new double[newSampleCount];
        for (int f = 0; f < frameCount; f++) {
            for (int s = 0; s < stripRows.length; s++) {
                newTime[(f * stripRows.length) + s] = dtPerScanLine * ((f * rowsPerFrame) + stripRows[s]);
            }
        }

        final int sampleCount = trace.size();
        final double[] time = new double[sampleCount];
        final double[] usableSignal = new double[sampleCount];
        final double[] usableTime = new double[quality.getUsableCount()];
        final double[] usableX = new double[usableTime.length];
        final double[] usableY = new double[usableTime.length];
        int u = 0;
        for (int i = 0; i < sampleCount; i++) {
            time[i] = trace.getTime(i);
            if (quality.isUsable(i)) {
                usableSignal[i] = 1.0;
                usableTime[u] = time[i];
                usableX[u] = trace.getX(i);
                usableY[u] = trace.getY(i);
                u++;
            }
        }

        final LinearSampleInterpolator usabilityInterpolator = new LinearSampleInterpolator(time, usableSignal);

        final double[] newX;
        final double[] newY;
        if (usableTime.length > 0) {
            newX = new LinearSampleInterpolator(usableTime, usableX).values(newTime);
            newY = new LinearSampleInterpolator(usableTime, usableY).values(newTime);
        } else {
            newX = nanArray(newSampleCount);
            newY = nanArray(newSampleCount);
        }

        final boolean[] newUsable = new boolean[newSampleCount];
        for (int i = 0; i < newSampleCount; i++) {
            // NaN (outside the sampled time range) is never > 0.5
            newUsable[i] = usabilityInterpolator.value(newTime[i]) > 0.5;
        }

        final ResampledTrace resampledTrace = new ResampledTrace(stripRows, frameCount, newTime, newX, newY, newUsable);

        LOG.debug("resample: mapped {} samples onto {} strips ({} per frame), {} usable, dtPerScanLine={}",
                  sampleCount, newSampleCount, stripRows.length, resampledTrace.getUsableCount(), dtPerScanLine);

        return resampledTrace;
    }

    private double getTimePerScanLine(final MotionTrace trace)
            throws ReferenceConfigurationException {

        final int[] rowNumbers = trace.getRowNumbers();
        final double rowDelta;
        if (rowNumbers.length > 1) {
            rowDelta = rowNumbers[1] - rowNumbers[0];
        } else {
            // one analyzed strip per frame, so consecutive samples are one (untrimmed) frame apart
            rowDelta = trimTotal + frameHeight;
        }

        if (rowDelta <= 0) {
            throw new ReferenceConfigurationException("strip rowNumbers template must be increasing but starts with " +
                                                      rowNumbers[0] + ", " + rowNumbers[1]);
        }

        final double timeDelta = trace.getTime(1) - trace.getTime(0);
        if (! (timeDelta > 0)) {
            throw new ReferenceConfigurationException("motion trace time stamps must be increasing but start with " +
                                                      trace.getTime(0) + ", " + trace.getTime(1));
        }

        return timeDelta / rowDelta;
    }

    private static double[] nanArray(final int size) {
        final double[] array = new double[size];
        Arrays.fill(array, Double.NaN);
        return array;
    }

    private static final Logger LOG = LoggerFactory.getLogger(PositionResampler.class);
}
