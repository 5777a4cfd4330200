package ir.ipaam.pdflayout.domain.geometry;

public record Size(double width, double height) {

    public static final Size ZERO = new Size(0, 0);

    public static Size square(double dimension) {
        return new Size(dimension, dimension);
    }

    public double along(Axis axis) {
        return axis == Axis.HORIZONTAL ? width : height;
    }

    public double across(Axis axis) {
        return axis == Axis.HORIZONTAL ? height : width;
    }

    public static Size of(Axis axis, double main, double cross) {
        return axis == Axis.HORIZONTAL ? new Size(main, cross) : new Size(cross, main);
    }

    public boolean isFinite() {
        return Double.isFinite(width) && Double.isFinite(height);
    }
}
