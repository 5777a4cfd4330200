package ir.ipaam.pdflayout.domain.geometry;

/**
 * Anchor point inside a box, expressed as fractions from -1 (start) to 1 (end) on each axis.
 */
public enum Alignment {
    TOP_LEFT(-1, -1),
    TOP_CENTER(0, -1),
    TOP_RIGHT(1, -1),
    CENTER_LEFT(-1, 0),
    CENTER(0, 0),
    CENTER_RIGHT(1, 0),
    BOTTOM_LEFT(-1, 1),
    BOTTOM_CENTER(0, 1),
    BOTTOM_RIGHT(1, 1);

    private final double x;
    private final double y;

    Alignment(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    /**
     * Top-left offset of {@code child} placed inside {@code container} at this anchor.
     */
    public Point resolve(Size container, Size child) {
        double freeWidth = container.width() - child.width();
        double freeHeight = container.height() - child.height();
        return new Point(freeWidth * (x + 1) / 2, freeHeight * (y + 1) / 2);
    }

    /**
     * Same anchor with its horizontal component mirrored, used for right-to-left layouts.
     */
    public Alignment mirrored() {
        for (Alignment candidate : values()) {
            if (candidate.x == -x && candidate.y == y) {
                return candidate;
            }
        }
        return this;
    }
}
