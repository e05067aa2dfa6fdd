package org.revas.reference;

/**
 * Thrown when no strip sample passes the quality filter, so the mosaic extent is undefined.
 */
public class DegenerateMotionException
        extends IllegalStateException {

    public DegenerateMotionException(final String message) {
        super(message);
    }

}
