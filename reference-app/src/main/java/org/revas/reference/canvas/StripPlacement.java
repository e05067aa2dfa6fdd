package org.revas.reference.canvas;

/**
 * Top left canvas pixel at which a (scaled) strip is placed.
 * A placement derived from an undefined (NaN) strip position is itself undefined and is never drawn.
 */
public class StripPlacement {

    public static final StripPlacement UNDEFINED = new StripPlacement(0, 0, false);

    private final int x;
    private final int y;
    private final boolean defined;

    public StripPlacement(final int x,
                          final int y) {
        this(x, y, true);
    }

    private StripPlacement(final int x,
                           final int y,
                           final boolean defined) {
        this.x = x;
        this.y = y;
        this.defined = defined;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public boolean isDefined() {
        return defined;
    }

    @Override
    public String toString() {
        return defined ? "(" + x + ", " + y + ")" : "undefined";
    }
}
