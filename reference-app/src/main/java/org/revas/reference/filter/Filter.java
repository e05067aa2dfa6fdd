package org.revas.reference.filter;

import ij.process.ImageProcessor;

/**
 * Common interface for per-strip filter implementations.
 */
public interface Filter {

    /**
     * Apply this filter.
     *
     * @param  ip     pixels to process.
     * @param  scale  scale of the pixels relative to the source frame.
     *
     * @return filtered image.
     */
    ImageProcessor process(final ImageProcessor ip,
                           final double scale);

}
