package org.revas.reference.motion;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.revas.reference.ReferenceConfigurationException;

/**
 * Piecewise linear interpolation of sampled values that yields NaN outside the sampled range
 * instead of extrapolating.
 */
public class LinearSampleInterpolator {

    private final double[] knots;
    private final double[] values;
    private final PolynomialSplineFunction function;

    /**
     * @param  knots   strictly increasing sample locations.
     * @param  values  sample values.
     *
     * @throws ReferenceConfigurationException
     *   if the knots are not strictly increasing or the arrays differ in length.
     */
    public LinearSampleInterpolator(final double[] knots,
                                    final double[] values)
            throws ReferenceConfigurationException {

        if (knots.length != values.length) {
            throw new ReferenceConfigurationException("cannot interpolate " + values.length + " values at " +
                                                      knots.length + " locations");
        }

        this.knots = knots;
        this.values = values;

        if (knots.length > 1) {
            try {
                this.function = new LinearInterpolator().interpolate(knots, values);
            } catch (final MathIllegalArgumentException e) {
                throw new ReferenceConfigurationException("failed to build interpolation function", e);
            }
        } else {
            this.function = null;
        }
    }

    /**
     * @return interpolated value at the specified location or NaN if the location is outside the sampled range.
     */
    public double value(final double location) {
        final double result;
        if (function != null) {
            result = function.isValidPoint(location) ? function.value(location) : Double.NaN;
        } else if ((knots.length == 1) && (location == knots[0])) {
            result = values[0];
        } else {
            result = Double.NaN;
        }
        return result;
    }

    public double[] values(final double[] locations) {
        final double[] result = new double[locations.length];
        for (int i = 0; i < locations.length; i++) {
            result[i] = value(locations[i]);
        }
        return result;
    }

}
