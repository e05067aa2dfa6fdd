package org.revas.reference.canvas;

import org.revas.reference.DegenerateMotionException;
import org.revas.reference.ReferenceConfigurationException;
import org.revas.reference.motion.MotionTrace;
import org.revas.reference.motion.StripQualityFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sizes the accumulation canvas so that every usable strip fits at the requested sub-pixel scale.
 *
 * The motion extent is taken from the usable trace samples.  Resampled positions are linear
 * combinations of those samples, so they always fall within the same extent.
 */
public class CanvasAllocator {

    private final int subpixelExponent;
    private final int frameWidth;
    private final int frameHeight;
    private final int newStripWidth;

    public CanvasAllocator(final int subpixelExponent,
                           final int frameWidth,
                           final int frameHeight,
                           final int newStripWidth)
            throws ReferenceConfigurationException {

        if (subpixelExponent < 0) {
            throw new ReferenceConfigurationException("subpixelExponent must be >= 0 but is " + subpixelExponent);
        }
        if (newStripWidth < 1) {
            throw new ReferenceConfigurationException("newStripWidth must be > 0 but is " + newStripWidth);
        }

        this.subpixelExponent = subpixelExponent;
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
        this.newStripWidth = newStripWidth;
    }

    /**
     * @throws DegenerateMotionException
     *   if no sample is usable.
     */
    public CanvasGeometry buildGeometry(final MotionTrace trace,
                                        final StripQualityFilter.Result quality)
            throws DegenerateMotionException {

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;

        for (int i = 0; i < trace.size(); i++) {
            if (quality.isUsable(i)) {
                minX = Math.min(minX, trace.getX(i));
                minY = Math.min(minY, trace.getY(i));
                maxX = Math.max(maxX, trace.getX(i));
                maxY = Math.max(maxY, trace.getY(i));
            }
        }

        if (! quality.hasUsableSamples()) {
            throw new DegenerateMotionException("none of the " + trace.size() +
                                                " strips passed the quality filter, " +
                                                "consider relaxing minPeakThreshold or maxMotionThreshold");
        }

        final int scale = 1 << subpixelExponent;
        final int width = (int) Math.round((maxX - minX + newStripWidth + 1) * scale);
        final int height = (int) Math.round((maxY - minY + frameHeight + 1) * scale);

        final int stripLeft = (int) Math.max(0, Math.round((frameWidth - newStripWidth) / 2.0));
        final int stripRight = Math.min(frameWidth, stripLeft + newStripWidth);

        final CanvasGeometry geometry = new CanvasGeometry(minX, minY, maxX, maxY, scale, width, height,
                                                           stripLeft, stripRight - stripLeft);

        LOG.debug("buildGeometry: returning {}", geometry);

        return geometry;
    }

    public AccumulationCanvas allocate(final CanvasGeometry geometry) {
        return new AccumulationCanvas(geometry.getWidth(), geometry.getHeight());
    }

    private static final Logger LOG = LoggerFactory.getLogger(CanvasAllocator.class);
}
