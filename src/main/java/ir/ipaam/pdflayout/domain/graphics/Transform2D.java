package ir.ipaam.pdflayout.domain.graphics;

import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;

/**
 * Affine transform {@code [a b c d tx ty]} applied to row vectors, the same layout as the PDF {@code cm} operator:
 * {@code x' = a*x + c*y + tx}, {@code y' = b*x + d*y + ty}.
 */
public record Transform2D(double a, double b, double c, double d, double tx, double ty) {

    private static final double EPSILON = 1e-10;

    public static final Transform2D IDENTITY = new Transform2D(1, 0, 0, 1, 0, 0);

    public static Transform2D identity() {
        return IDENTITY;
    }

    public static Transform2D translation(double x, double y) {
        return new Transform2D(1, 0, 0, 1, x, y);
    }

    public static Transform2D scaling(double sx, double sy) {
        return new Transform2D(sx, 0, 0, sy, 0, 0);
    }

    /**
     * Rotation by {@code angle} radians.
     */
    public static Transform2D rotation(double angle) {
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        return new Transform2D(cos, sin, -sin, cos, 0, 0);
    }

    public static Transform2D rotationAround(double angle, double cx, double cy) {
        return translation(-cx, -cy)
                .multiply(rotation(angle))
                .multiply(translation(cx, cy));
    }

    /**
     * Composition that applies {@code this} first and {@code other} second.
     */
    public Transform2D multiply(Transform2D other) {
        return new Transform2D(
                a * other.a + b * other.c,
                a * other.b + b * other.d,
                c * other.a + d * other.c,
                c * other.b + d * other.d,
                tx * other.a + ty * other.c + other.tx,
                tx * other.b + ty * other.d + other.ty);
    }

    public Point transformPoint(Point point) {
        return new Point(
                a * point.x() + c * point.y() + tx,
                b * point.x() + d * point.y() + ty);
    }

    /**
     * Transforms a size as a vector, ignoring translation.
     */
    public Size transformSize(Size size) {
        return new Size(
                Math.abs(a * size.width() + c * size.height()),
                Math.abs(b * size.width() + d * size.height()));
    }

    public double determinant() {
        return a * d - b * c;
    }

    public Transform2D inverse() {
        double det = determinant();
        if (Math.abs(det) < EPSILON) {
            throw new IllegalStateException("Transform is not invertible, determinant " + det);
        }
        return new Transform2D(
                d / det,
                -b / det,
                -c / det,
                a / det,
                (c * ty - d * tx) / det,
                (b * tx - a * ty) / det);
    }

    public boolean isIdentity() {
        return Math.abs(a - 1) < EPSILON && Math.abs(b) < EPSILON
                && Math.abs(c) < EPSILON && Math.abs(d - 1) < EPSILON
                && Math.abs(tx) < EPSILON && Math.abs(ty) < EPSILON;
    }

    public Point getTranslation() {
        return new Point(tx, ty);
    }

    public Point getScale() {
        return new Point(Math.sqrt(a * a + b * b), Math.sqrt(c * c + d * d));
    }

    public double getRotation() {
        return Math.atan2(b, a);
    }

    public double[] toArray() {
        return new double[]{a, b, c, d, tx, ty};
    }
}
