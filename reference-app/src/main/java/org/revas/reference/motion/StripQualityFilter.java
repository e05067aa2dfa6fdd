package org.revas.reference.motion;

import org.revas.reference.ReferenceConfigurationException;

/**
 * Classifies each analyzed strip as usable or not for reference frame construction.
 *
 * A strip is usable when its cross correlation peak is high enough and when the eye did not move
 * too much since the previous strip.  Motion is the length of the position change between
 * consecutive samples, expressed as a fraction of the frame height and scaled by the number of
 * analyzed strips per frame so that it reads as "frame heights per frame".
 */
public class StripQualityFilter {

    private final double minPeakThreshold;
    private final double maxMotionThreshold;

    public StripQualityFilter(final double minPeakThreshold,
                              final double maxMotionThreshold)
            throws ReferenceConfigurationException {

        if (Double.isNaN(minPeakThreshold) || (minPeakThreshold < 0.0) || (minPeakThreshold > 1.0)) {
            throw new ReferenceConfigurationException("minPeakThreshold must be between 0 and 1 but is " +
                                                      minPeakThreshold);
        }
        if (Double.isNaN(maxMotionThreshold) || (maxMotionThreshold < 0.0) || (maxMotionThreshold > 1.0)) {
            throw new ReferenceConfigurationException("maxMotionThreshold must be between 0 and 1 but is " +
                                                      maxMotionThreshold);
        }

        this.minPeakThreshold = minPeakThreshold;
        this.maxMotionThreshold = maxMotionThreshold;
    }

    /**
     * @param  trace        motion trace (without duplicate time stamps).
     * @param  frameHeight  height of each video frame in pixels.
     * @param  frameCount   number of frames in the video.
     *
     * @return per sample motion and usability.
     */
    public Result evaluate(final MotionTrace trace,
                           final int frameHeight,
                           final int frameCount) {

        final int sampleCount = trace.size();
        final double stripsPerFrame = (double) sampleCount / frameCount;

        final double[] motion = new double[sampleCount];
        final boolean[] usable = new boolean[sampleCount];
        int usableCount = 0;

        for (int i = 0; i < sampleCount; i++) {
            if (i > 0) {
                final double dx = (trace.getX(i) - trace.getX(i - 1)) / frameHeight;
                final double dy = (trace.getY(i) - trace.getY(i - 1)) / frameHeight;
                motion[i] = Math.sqrt((dx * dx) + (dy * dy)) * stripsPerFrame;
            }

            // NaN peaks or motion fail both comparisons
            usable[i] = (trace.getPeakValue(i) >= minPeakThreshold) &&
                        (motion[i] <= maxMotionThreshold) &&
                        hasDefinedPosition(trace, i);
            if (usable[i]) {
                usableCount++;
            }
        }

        return new Result(motion, usable, usableCount);
    }

    private static boolean hasDefinedPosition(final MotionTrace trace,
                                              final int index) {
        return ! (Double.isNaN(trace.getX(index)) || Double.isNaN(trace.getY(index)));
    }

    public static class Result {

        private final double[] motion;
        private final boolean[] usable;
        private final int usableCount;

        public Result(final double[] motion,
                      final boolean[] usable,
                      final int usableCount) {
            this.motion = motion;
            this.usable = usable;
            this.usableCount = usableCount;
        }

        public double getMotion(final int index) {
            return motion[index];
        }

        public boolean isUsable(final int index) {
            return usable[index];
        }

        public int size() {
            return usable.length;
        }

        public int getUsableCount() {
            return usableCount;
        }

        public boolean hasUsableSamples() {
            return usableCount > 0;
        }
    }

}
