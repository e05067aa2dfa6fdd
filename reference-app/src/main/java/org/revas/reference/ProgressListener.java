package org.revas.reference;

import ij.process.FloatProcessor;

/**
 * Observer for the running mosaic.
 */
public interface ProgressListener {

    /**
     * Called after all strips of a frame have been accumulated.
     *
     * @param  frameIndex        0-based index of the frame just processed.
     * @param  normalizedCanvas  current accumulator / counter values
     *                           (NaN where nothing has been placed yet).
     */
    void frameCompleted(final int frameIndex,
                        final FloatProcessor normalizedCanvas);

}
