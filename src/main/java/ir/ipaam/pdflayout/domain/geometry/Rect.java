package ir.ipaam.pdflayout.domain.geometry;

public record Rect(double x, double y, double width, double height) {

    public static Rect fromSize(Size size) {
        return new Rect(0, 0, size.width(), size.height());
    }

    public static Rect fromPoints(Point a, Point b) {
        double left = Math.min(a.x(), b.x());
        double top = Math.min(a.y(), b.y());
        return new Rect(left, top, Math.abs(a.x() - b.x()), Math.abs(a.y() - b.y()));
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public Point origin() {
        return new Point(x, y);
    }

    public Size size() {
        return new Size(width, height);
    }

    public Rect translate(double dx, double dy) {
        return new Rect(x + dx, y + dy, width, height);
    }

    public boolean contains(Point point) {
        return point.x() >= x && point.x() <= right() && point.y() >= y && point.y() <= bottom();
    }
}
