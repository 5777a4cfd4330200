package ir.ipaam.pdflayout.domain.geometry;

public record EdgeInsets(double top, double right, double bottom, double left) {

    public static final EdgeInsets ZERO = new EdgeInsets(0, 0, 0, 0);

    public static EdgeInsets all(double value) {
        return new EdgeInsets(value, value, value, value);
    }

    public static EdgeInsets symmetric(double vertical, double horizontal) {
        return new EdgeInsets(vertical, horizontal, vertical, horizontal);
    }

    public static EdgeInsets only(double top, double right, double bottom, double left) {
        return new EdgeInsets(top, right, bottom, left);
    }

    public double horizontal() {
        return left + right;
    }

    public double vertical() {
        return top + bottom;
    }

    public Point topLeft() {
        return new Point(left, top);
    }

    public Size deflateSize(Size size) {
        return new Size(
                Math.max(0, size.width() - horizontal()),
                Math.max(0, size.height() - vertical()));
    }

    public Size inflateSize(Size size) {
        return new Size(size.width() + horizontal(), size.height() + vertical());
    }

    public Rect deflateRect(Rect rect) {
        Size inner = deflateSize(rect.size());
        return new Rect(rect.x() + left, rect.y() + top, inner.width(), inner.height());
    }

    public BoxConstraints deflateConstraints(BoxConstraints constraints) {
        double minWidth = Math.max(0, constraints.minWidth() - horizontal());
        double minHeight = Math.max(0, constraints.minHeight() - vertical());
        return new BoxConstraints(
                minWidth,
                Math.max(minWidth, constraints.maxWidth() - horizontal()),
                minHeight,
                Math.max(minHeight, constraints.maxHeight() - vertical()));
    }
}
