package org.revas.reference.motion;

/**
 * Strip motion resampled onto the strip grid used to build the reference frame.
 * Samples are frame-major with a fixed number of strips per frame.
 */
public class ResampledTrace {

    private final int[] stripRows;
    private final int frameCount;
    private final double[] timeSec;
    private final double[] x;
    private final double[] y;
    private final boolean[] usable;

    public ResampledTrace(final int[] stripRows,
                          final int frameCount,
                          final double[] timeSec,
                          final double[] x,
                          final double[] y,
                          final boolean[] usable) {
        this.stripRows = stripRows;
        this.frameCount = frameCount;
        this.timeSec = timeSec;
        this.x = x;
        this.y = y;
        this.usable = usable;
    }

    public int getStripsPerFrame() {
        return stripRows.length;
    }

    public int getFrameCount() {
        return frameCount;
    }

    /**
     * @return 0-based first row of the specified strip within its frame.
     */
    public int getStripRow(final int stripIndex) {
        return stripRows[stripIndex];
    }

    public int size() {
        return timeSec.length;
    }

    public int getSampleIndex(final int frameIndex,
                              final int stripIndex) {
        return (frameIndex * stripRows.length) + stripIndex;
    }

    public double getTime(final int sampleIndex) {
        return timeSec[sampleIndex];
    }

    public double getX(final int sampleIndex) {
        return x[sampleIndex];
    }

    public double getY(final int sampleIndex) {
        return y[sampleIndex];
    }

    public boolean isUsable(final int sampleIndex) {
        return usable[sampleIndex];
    }

    public MotionSample getSample(final int frameIndex,
                                  final int stripIndex) {
        final int i = getSampleIndex(frameIndex, stripIndex);
        return new MotionSample(timeSec[i], x[i], y[i], Double.NaN, usable[i]);
    }

    public int getUsableCount() {
        int count = 0;
        for (final boolean u : usable) {
            if (u) {
                count++;
            }
        }
        return count;
    }

}
