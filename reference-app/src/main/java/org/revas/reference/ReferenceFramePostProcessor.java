package org.revas.reference;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.awt.Rectangle;

import org.revas.reference.canvas.AccumulationCanvas;
import org.revas.reference.filter.NoiseFill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a filled accumulation canvas into the final reference frame.
 *
 * <ol>
 *   <li>sub-pixel canvases are downsampled back to native resolution (accumulator, then counter),</li>
 *   <li>rows and columns outside the covered bounding box are cropped,</li>
 *   <li>accumulator / counter gives the floating point reference (NaN where uncovered),</li>
 *   <li>the reference is rounded to 8 bits and uncovered pixels are filled with noise sampled from covered ones.</li>
 * </ol>
 *
 * Both grids are downsampled before they are divided.  This is not an exact area average
 * but matches the mosaics produced by earlier versions of this tool.
 */
public class ReferenceFramePostProcessor {

    private final int scale;
    private final NoiseFill noiseFill;

    public ReferenceFramePostProcessor(final int scale,
                                       final long noiseSeed) {
        this.scale = scale;
        this.noiseFill = new NoiseFill(noiseSeed);
    }

    /**
     * @throws DegenerateMotionException
     *   if no strip was placed on the canvas.
     */
    public Result process(final AccumulationCanvas canvas)
            throws DegenerateMotionException {

        if (canvas.isEmpty()) {
            throw new DegenerateMotionException("no strips were placed on the " + canvas.getWidth() + "x" +
                                                canvas.getHeight() + " canvas, all frames may be bad");
        }

        FloatProcessor accumulator = canvas.getAccumulatorProcessor();
        FloatProcessor counter = canvas.getCounterProcessor();

        if (scale > 1) {
            accumulator = downsample(accumulator);
            counter = downsample(counter);
        }

        final Rectangle coveredBounds = findCoveredBounds(counter);
        if (coveredBounds == null) {
            throw new DegenerateMotionException("no covered pixels remain after downsampling the canvas");
        }

        accumulator = crop(accumulator, coveredBounds);
        counter = crop(counter, coveredBounds);

        final FloatProcessor referenceFloat = divide(accumulator, counter);
        final ByteProcessor reference = quantize(referenceFloat);
        noiseFill.process(reference, counter);

        LOG.debug("process: cropped {}x{} canvas to {}", canvas.getWidth(), canvas.getHeight(), coveredBounds);

        return new Result(reference, referenceFloat, counter);
    }

    FloatProcessor downsample(final FloatProcessor fp) {
        final int width = (fp.getWidth() + scale - 1) / scale;
        final int height = (fp.getHeight() + scale - 1) / scale;
        fp.setInterpolationMethod(ImageProcessor.BILINEAR);
        return (FloatProcessor) fp.resize(width, height, true);
    }

    /**
     * @return inclusive bounding box of pixels with a positive count, or null if there are none.
     */
    static Rectangle findCoveredBounds(final FloatProcessor counter) {
        final int width = counter.getWidth();
        final int height = counter.getHeight();

        int minX = width;
        int minY = height;
        int maxX = -1;
        int maxY = -1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (counter.getf(x, y) > 0) {
                    minX = Math.min(minX, x);
                    maxX = Math.max(maxX, x);
                    minY = Math.min(minY, y);
                    maxY = Math.max(maxY, y);
                }
            }
        }

        return maxX < 0 ? null : new Rectangle(minX, minY, maxX - minX + 1, maxY - minY + 1);
    }

    private static FloatProcessor crop(final FloatProcessor fp,
                                       final Rectangle bounds) {
        fp.setRoi(bounds);
        final FloatProcessor cropped = (FloatProcessor) fp.crop();
        fp.resetRoi();
        return cropped;
    }

    private static FloatProcessor divide(final FloatProcessor accumulator,
                                         final FloatProcessor counter) {
        final float[] sum = (float[]) accumulator.getPixels();
        final float[] count = (float[]) counter.getPixels();
        final float[] normalized = new float[sum.length];
        for (int i = 0; i < sum.length; i++) {
            normalized[i] = count[i] > 0 ? sum[i] / count[i] : Float.NaN;
        }
        return new FloatProcessor(accumulator.getWidth(), accumulator.getHeight(), normalized);
    }

    private static ByteProcessor quantize(final FloatProcessor referenceFloat) {
        final float[] values = (float[]) referenceFloat.getPixels();
        final byte[] pixels = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            pixels[i] = (byte) AccumulationCanvas.toByteRange(values[i]);
        }
        return new ByteProcessor(referenceFloat.getWidth(), referenceFloat.getHeight(), pixels);
    }

    /**
     * Post processing outcome.
     */
    public static class Result {

        private final ByteProcessor reference;
        private final FloatProcessor referenceFloat;
        private final FloatProcessor counter;

        public Result(final ByteProcessor reference,
                      final FloatProcessor referenceFloat,
                      final FloatProcessor counter) {
            this.reference = reference;
            this.referenceFloat = referenceFloat;
            this.counter = counter;
        }

        public ByteProcessor getReference() {
            return reference;
        }

        public FloatProcessor getReferenceFloat() {
            return referenceFloat;
        }

        public FloatProcessor getCounter() {
            return counter;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceFramePostProcessor.class);
}
