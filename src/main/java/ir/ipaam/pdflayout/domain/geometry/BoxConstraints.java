package ir.ipaam.pdflayout.domain.geometry;

/**
 * Min/max bounds a parent imposes on a child's width and height before layout.
 * <p>
 * Values are immutable. A constraints value is only meaningful when {@link #isValid()} holds:
 * every bound is non-negative, max is not below min, and the minimums are finite. The maximums
 * may be {@link Double#POSITIVE_INFINITY} to express an unbounded axis.
 */
public record BoxConstraints(double minWidth, double maxWidth, double minHeight, double maxHeight) {

    public static final BoxConstraints UNBOUNDED =
            new BoxConstraints(0, Double.POSITIVE_INFINITY, 0, Double.POSITIVE_INFINITY);

    public static BoxConstraints tight(Size size) {
        return new BoxConstraints(size.width(), size.width(), size.height(), size.height());
    }

    public static BoxConstraints loose(Size size) {
        return new BoxConstraints(0, size.width(), 0, size.height());
    }

    /**
     * Tight on the given dimensions, infinite on the ones left {@code null}.
     */
    public static BoxConstraints expand(Double width, Double height) {
        double w = width != null ? width : Double.POSITIVE_INFINITY;
        double h = height != null ? height : Double.POSITIVE_INFINITY;
        return new BoxConstraints(w, w, h, h);
    }

    /**
     * Tight on the given dimensions, unconstrained on the ones left {@code null}.
     */
    public static BoxConstraints tightFor(Double width, Double height) {
        return new BoxConstraints(
                width != null ? width : 0,
                width != null ? width : Double.POSITIVE_INFINITY,
                height != null ? height : 0,
                height != null ? height : Double.POSITIVE_INFINITY);
    }

    public static BoxConstraints of(Axis axis, double minMain, double maxMain, double minCross, double maxCross) {
        return axis == Axis.HORIZONTAL
                ? new BoxConstraints(minMain, maxMain, minCross, maxCross)
                : new BoxConstraints(minCross, maxCross, minMain, maxMain);
    }

    public boolean isValid() {
        return minWidth >= 0 && minHeight >= 0
                && maxWidth >= minWidth && maxHeight >= minHeight
                && Double.isFinite(minWidth) && Double.isFinite(minHeight);
    }

    public Size constrain(Size size) {
        return new Size(constrainWidth(size.width()), constrainHeight(size.height()));
    }

    public double constrainWidth(double width) {
        return Math.max(minWidth, Math.min(maxWidth, width));
    }

    public double constrainHeight(double height) {
        return Math.max(minHeight, Math.min(maxHeight, height));
    }

    public boolean satisfies(Size size) {
        return size.width() >= minWidth && size.width() <= maxWidth
                && size.height() >= minHeight && size.height() <= maxHeight;
    }

    public boolean isTight() {
        return minWidth == maxWidth && minHeight == maxHeight;
    }

    public boolean hasBoundedWidth() {
        return maxWidth < Double.POSITIVE_INFINITY;
    }

    public boolean hasBoundedHeight() {
        return maxHeight < Double.POSITIVE_INFINITY;
    }

    public boolean hasBounded(Axis axis) {
        return axis == Axis.HORIZONTAL ? hasBoundedWidth() : hasBoundedHeight();
    }

    public double minAlong(Axis axis) {
        return axis == Axis.HORIZONTAL ? minWidth : minHeight;
    }

    public double maxAlong(Axis axis) {
        return axis == Axis.HORIZONTAL ? maxWidth : maxHeight;
    }

    public BoxConstraints loosen() {
        return new BoxConstraints(0, maxWidth, 0, maxHeight);
    }

    public Size biggest() {
        return new Size(constrainWidth(Double.POSITIVE_INFINITY), constrainHeight(Double.POSITIVE_INFINITY));
    }

    public Size smallest() {
        return new Size(minWidth, minHeight);
    }

    /**
     * Clamps these constraints into {@code other} so the result never leaves its range.
     */
    public BoxConstraints enforce(BoxConstraints other) {
        return new BoxConstraints(
                clamp(minWidth, other.minWidth, other.maxWidth),
                clamp(maxWidth, other.minWidth, other.maxWidth),
                clamp(minHeight, other.minHeight, other.maxHeight),
                clamp(maxHeight, other.minHeight, other.maxHeight));
    }

    public BoxConstraints withMaxWidth(double width) {
        return new BoxConstraints(Math.min(minWidth, width), width, minHeight, maxHeight);
    }

    public BoxConstraints withMaxHeight(double height) {
        return new BoxConstraints(minWidth, maxWidth, Math.min(minHeight, height), height);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    @Override
    public String toString() {
        return "BoxConstraints(w: " + minWidth + ".." + maxWidth + ", h: " + minHeight + ".." + maxHeight + ")";
    }
}
