package org.revas.reference.motion;

/**
 * Position and quality of one strip at one point in time.
 * Resampled strips have no correlation peak of their own, so their peak value is NaN.
 */
public class MotionSample {

    private final double timeSec;
    private final double x;
    private final double y;
    private final double peakValue;
    private final boolean usable;

    public MotionSample(final double timeSec,
                        final double x,
                        final double y,
                        final double peakValue,
                        final boolean usable) {
        this.timeSec = timeSec;
        this.x = x;
        this.y = y;
        this.peakValue = peakValue;
        this.usable = usable;
    }

    public double getTimeSec() {
        return timeSec;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getPeakValue() {
        return peakValue;
    }

    public boolean isUsable() {
        return usable;
    }

    public boolean hasDefinedPosition() {
        return ! (Double.isNaN(x) || Double.isNaN(y));
    }

    @Override
    public String toString() {
        return "{ \"timeSec\": " + timeSec + ", \"x\": " + x + ", \"y\": " + y +
               ", \"peakValue\": " + peakValue + ", \"usable\": " + usable + " }";
    }
}
