package org.revas.reference.filter;

import ij.process.ImageProcessor;

import java.util.Random;

/**
 * Replaces uncovered pixels with values drawn (with replacement) from the covered pixels of the same image,
 * so that holes in the mosaic do not show up as structured black regions.
 *
 * The random source is seeded so that the same input always yields the same image.
 */
public class NoiseFill implements CoverageFilter {

    private final long seed;

    public NoiseFill(final long seed) {
        this.seed = seed;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final ImageProcessor coverage) {

        final int n = ip.getPixelCount();
        final float[] coveredValues = new float[n];
        int coveredCount = 0;
        for (int i = 0; i < n; i++) {
            if (CoverageFilter.isCovered(coverage, i)) {
                coveredValues[coveredCount] = ip.getf(i);
                coveredCount++;
            }
        }

        if ((coveredCount == 0) || (coveredCount == n)) {
            return ip;
        }

        final Random rnd = new Random(seed);
        for (int i = 0; i < n; i++) {
            if (! CoverageFilter.isCovered(coverage, i)) {
                ip.setf(i, coveredValues[rnd.nextInt(coveredCount)]);
            }
        }

        return ip;
    }

}
