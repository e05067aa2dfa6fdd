package org.revas.reference.canvas;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.Arrays;

/**
 * Pair of equally sized grids holding the running sum of strip intensities placed on each pixel
 * and the number of strips that contributed to it.
 * Grid dimensions are fixed for the lifetime of the canvas.
 */
public class AccumulationCanvas {

    private final int width;
    private final int height;
    private final double[] accumulator;
    private final int[] counter;

    public AccumulationCanvas(final int width,
                              final int height) {
        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("canvas dimensions must be positive but are " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.accumulator = new double[width * height];
        this.counter = new int[width * height];
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double getSum(final int x,
                         final int y) {
        return accumulator[(y * width) + x];
    }

    public int getCount(final int x,
                        final int y) {
        return counter[(y * width) + x];
    }

    /**
     * Adds the strip's pixel values at the specified placement and increments the count of each covered pixel.
     * Strip pixels that fall outside the canvas are ignored.
     *
     * @return number of canvas pixels covered by the strip.
     */
    public int add(final ImageProcessor strip,
                   final StripPlacement placement) {

        if (! placement.isDefined()) {
            return 0;
        }

        final int minStripX = Math.max(0, -placement.getX());
        final int minStripY = Math.max(0, -placement.getY());
        final int maxStripX = Math.min(strip.getWidth(), width - placement.getX());
        final int maxStripY = Math.min(strip.getHeight(), height - placement.getY());

        int coveredCount = 0;
        for (int sy = minStripY; sy < maxStripY; sy++) {
            int i = ((placement.getY() + sy) * width) + placement.getX() + minStripX;
            for (int sx = minStripX; sx < maxStripX; sx++) {
                accumulator[i] += strip.getf(sx, sy);
                counter[i]++;
                i++;
                coveredCount++;
            }
        }
        return coveredCount;
    }

    public void reset() {
        Arrays.fill(accumulator, 0.0);
        Arrays.fill(counter, 0);
    }

    public boolean isEmpty() {
        for (final int count : counter) {
            if (count > 0) {
                return false;
            }
        }
        return true;
    }

    public FloatProcessor getAccumulatorProcessor() {
        final float[] pixels = new float[accumulator.length];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = (float) accumulator[i];
        }
        return new FloatProcessor(width, height, pixels);
    }

    public FloatProcessor getCounterProcessor() {
        final float[] pixels = new float[counter.length];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = counter[i];
        }
        return new FloatProcessor(width, height, pixels);
    }

    /**
     * @return accumulator / counter with NaN for pixels that nothing was placed on.
     */
    public FloatProcessor getNormalizedProcessor() {
        final float[] pixels = new float[accumulator.length];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = counter[i] > 0 ? (float) (accumulator[i] / counter[i]) : Float.NaN;
        }
        return new FloatProcessor(width, height, pixels);
    }

    /**
     * @return accumulator / counter rounded and clamped to 8 bits with 0 for pixels that nothing was placed on.
     */
    public ByteProcessor getNormalizedByteProcessor() {
        final byte[] pixels = new byte[accumulator.length];
        for (int i = 0; i < pixels.length; i++) {
            if (counter[i] > 0) {
                pixels[i] = (byte) toByteRange(accumulator[i] / counter[i]);
            }
        }
        return new ByteProcessor(width, height, pixels);
    }

    public static int toByteRange(final double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return (int) Math.max(0, Math.min(255, Math.round(value)));
    }

}
