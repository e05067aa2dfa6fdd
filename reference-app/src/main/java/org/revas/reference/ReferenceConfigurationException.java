package org.revas.reference;

/**
 * Thrown when the upstream strip geometry is missing or a build parameter is out of range.
 */
public class ReferenceConfigurationException
        extends IllegalArgumentException {

    public ReferenceConfigurationException(final String message) {
        super(message);
    }

    public ReferenceConfigurationException(final String message,
                                           final Throwable cause) {
        super(message, cause);
    }

}
