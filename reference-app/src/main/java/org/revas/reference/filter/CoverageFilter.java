package org.revas.reference.filter;

import ij.process.ImageProcessor;

/**
 * Filter that repairs pixels which no strip has been placed on.
 */
public interface CoverageFilter {

    /**
     * @param  ip        pixels to repair (modified in place).
     * @param  coverage  same sized image whose non-positive (or NaN) values mark uncovered pixels.
     *
     * @return the repaired image.
     */
    ImageProcessor process(final ImageProcessor ip,
                           final ImageProcessor coverage);

    static boolean isCovered(final ImageProcessor coverage,
                             final int index) {
        // NaN comparisons are false, so NaN counts as uncovered
        return coverage.getf(index) > 0;
    }

}
