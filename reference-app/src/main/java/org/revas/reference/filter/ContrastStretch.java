package org.revas.reference.filter;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

/**
 * Linearly stretches 8-bit intensities so that the darkest and brightest {@code saturatedFraction}
 * of pixels saturate at 0 and 255.  Images whose limits coincide (e.g. uniform strips) are left unchanged.
 */
public class ContrastStretch implements Filter {

    public static final double DEFAULT_SATURATED_FRACTION = 0.01;

    private final double saturatedFraction;

    public ContrastStretch() {
        this(DEFAULT_SATURATED_FRACTION);
    }

    public ContrastStretch(final double saturatedFraction) {
        this.saturatedFraction = saturatedFraction;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final double scale) {

        final ByteProcessor bp = ip instanceof ByteProcessor ? (ByteProcessor) ip : ip.convertToByteProcessor(false);

        final int[] limits = findLimits(bp.getHistogram(), bp.getPixelCount(), saturatedFraction);
        final int low = limits[0];
        final int high = limits[1];

        if (low < high) {
            final int[] table = new int[256];
            final double range = high - low;
            for (int i = 0; i < table.length; i++) {
                final double stretched = (i - low) / range;
                table[i] = (int) Math.round(255.0 * Math.max(0.0, Math.min(1.0, stretched)));
            }
            bp.applyTable(table);
        }

        return bp;
    }

    /**
     * @return [low, high] intensities such that the cumulative fraction of pixels below low exceeds
     *         saturatedFraction and the cumulative fraction at high reaches 1 - saturatedFraction.
     */
    static int[] findLimits(final int[] histogram,
                            final int pixelCount,
                            final double saturatedFraction) {
        final double lowTolerance = saturatedFraction * pixelCount;
        final double highTolerance = (1.0 - saturatedFraction) * pixelCount;

        int low = -1;
        int high = -1;
        long cumulative = 0;
        for (int i = 0; i < histogram.length; i++) {
            cumulative += histogram[i];
            if ((low < 0) && (cumulative > lowTolerance)) {
                low = i;
            }
            if ((high < 0) && (cumulative >= highTolerance)) {
                high = i;
            }
        }
        if (low < 0) {
            low = 0;
        }
        if (high < 0) {
            high = histogram.length - 1;
        }
        return new int[] { low, high };
    }

}
