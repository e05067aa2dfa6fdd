package org.revas.reference;

import com.beust.jcommander.IStringConverter;
import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * How much a reference frame build reports while it runs.
 */
public enum Verbosity {

    /** Warnings only. */
    NONE,

    /** Entry, exit and canvas geometry. */
    SUMMARY,

    /** Everything in {@link #SUMMARY} plus one line and one progress notification per frame. */
    PER_FRAME;

    public boolean isAtLeast(final Verbosity level) {
        return this.ordinal() >= level.ordinal();
    }

    /**
     * Parses verbosity names case-insensitively.
     * Also accepts the legacy names "video" (summary) and "frame" (per frame) along with level numbers 0, 1 and 2.
     */
    @JsonCreator
    public static Verbosity fromString(final String value)
            throws IllegalArgumentException {

        if (value == null) {
            throw new IllegalArgumentException("verbosity must be specified");
        }

        final String normalized = value.trim().replace("_", "").replace("-", "").toLowerCase();
        switch (normalized) {
            case "none":
            case "0":
            case "false":
                return NONE;
            case "summary":
            case "video":
            case "1":
            case "true":
                return SUMMARY;
            case "perframe":
            case "frame":
            case "2":
                return PER_FRAME;
            default:
                throw new IllegalArgumentException("unknown verbosity '" + value +
                                                   "', valid values are none, summary, and perFrame");
        }
    }

    public static class Converter implements IStringConverter<Verbosity> {
        @Override
        public Verbosity convert(final String value) {
            return fromString(value);
        }
    }

}
