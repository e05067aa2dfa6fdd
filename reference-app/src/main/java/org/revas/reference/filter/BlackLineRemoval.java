package org.revas.reference.filter;

import ij.process.ImageProcessor;

/**
 * Fills short vertical gaps of uncovered pixels (typically whole scan lines left black because
 * neighboring strips were rounded apart) by linear interpolation between the covered pixels
 * directly above and below the gap.  Gaps at the image border or longer than
 * {@code maxGapHeight} are left as they are.
 */
public class BlackLineRemoval implements CoverageFilter {

    public static final int DEFAULT_MAX_GAP_HEIGHT = 2;

    private final int maxGapHeight;

    public BlackLineRemoval() {
        this(DEFAULT_MAX_GAP_HEIGHT);
    }

    public BlackLineRemoval(final int maxGapHeight) {
        this.maxGapHeight = maxGapHeight;
    }

    /**
     * @param  scale  sub-pixel scale of the image, gaps up to maxGapHeight * scale rows are filled.
     */
    public static BlackLineRemoval forScale(final int scale) {
        return new BlackLineRemoval(DEFAULT_MAX_GAP_HEIGHT * scale);
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final ImageProcessor coverage) {

        final int width = ip.getWidth();
        final int height = ip.getHeight();

        for (int x = 0; x < width; x++) {
            int lastCoveredY = -1;
            for (int y = 0; y < height; y++) {
                if (CoverageFilter.isCovered(coverage, (y * width) + x)) {
                    final int gapHeight = y - lastCoveredY - 1;
                    if ((lastCoveredY >= 0) && (gapHeight > 0) && (gapHeight <= maxGapHeight)) {
                        fillGap(ip, x, lastCoveredY, y);
                    }
                    lastCoveredY = y;
                }
            }
        }

        return ip;
    }

    private static void fillGap(final ImageProcessor ip,
                                final int x,
                                final int aboveY,
                                final int belowY) {
        final float above = ip.getf(x, aboveY);
        final float below = ip.getf(x, belowY);
        final int span = belowY - aboveY;
        for (int y = aboveY + 1; y < belowY; y++) {
            final float weight = (float) (y - aboveY) / span;
            ip.setf(x, y, above + (weight * (below - above)));
        }
    }

}
