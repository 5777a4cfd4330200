package ir.ipaam.pdflayout.domain.geometry;

public record Point(double x, double y) {

    public static final Point ZERO = new Point(0, 0);

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public Point plus(Point other) {
        return new Point(x + other.x, y + other.y);
    }
}
