package org.revas.reference.canvas;

import java.io.Serializable;

import org.revas.reference.motion.MotionSample;

/**
 * Size of the accumulation canvas along with the extent of the motion that determined it
 * and the column window cut from each frame.
 */
public class CanvasGeometry
        implements Serializable {

    private final double minX;
    private final double minY;
    private final double maxX;
    private final double maxY;
    private final int scale;
    private final int width;
    private final int height;
    private final int stripLeft;
    private final int stripWidth;

    public CanvasGeometry(final double minX,
                          final double minY,
                          final double maxX,
                          final double maxY,
                          final int scale,
                          final int width,
                          final int height,
                          final int stripLeft,
                          final int stripWidth) {
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
        this.scale = scale;
        this.width = width;
        this.height = height;
        this.stripLeft = stripLeft;
        this.stripWidth = stripWidth;
    }

    public double getMinX() {
        return minX;
    }

    public double getMinY() {
        return minY;
    }

    public double getMaxX() {
        return maxX;
    }

    public double getMaxY() {
        return maxY;
    }

    public int getScale() {
        return scale;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getStripLeft() {
        return stripLeft;
    }

    public int getStripWidth() {
        return stripWidth;
    }

    /**
     * @param  sample    resampled strip position.
     * @param  stripRow  0-based first row of the strip within its frame.
     *
     * @return canvas location for the scaled strip.
     */
    public StripPlacement getPlacement(final MotionSample sample,
                                       final int stripRow) {
        if (! sample.hasDefinedPosition()) {
            return StripPlacement.UNDEFINED;
        }
        final long x = Math.round(scale * (sample.getX() - minX));
        final long y = Math.round(scale * (sample.getY() - minY + stripRow));
        return new StripPlacement((int) x, (int) y);
    }

    @Override
    public String toString() {
        return "{ \"width\": " + width + ", \"height\": " + height + ", \"scale\": " + scale +
               ", \"minX\": " + minX + ", \"minY\": " + minY + ", \"maxX\": " + maxX + ", \"maxY\": " + maxY +
               ", \"stripLeft\": " + stripLeft + ", \"stripWidth\": " + stripWidth + " }";
    }
}
