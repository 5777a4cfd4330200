package ir.ipaam.pdflayout.domain.graphics;

import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Rect;

/**
 * Conversions between the top-left, Y-down screen space widgets author in and the bottom-left, Y-up PDF space.
 */
public final class CoordinateSpace {

    public static final double POINTS_PER_INCH = 72.0;
    public static final double MM_PER_INCH = 25.4;

    private CoordinateSpace() {
    }

    public static Point screenToPdf(Point point, double pageHeight) {
        return new Point(point.x(), pageHeight - point.y());
    }

    public static Point pdfToScreen(Point point, double pageHeight) {
        return new Point(point.x(), pageHeight - point.y());
    }

    /**
     * Rectangle with its origin moved to the bottom-left corner; width and height keep their magnitude.
     */
    public static Rect screenRectToPdf(Rect rect, double pageHeight) {
        return new Rect(rect.x(), pageHeight - rect.y() - rect.height(), rect.width(), rect.height());
    }

    public static Rect pdfRectToScreen(Rect rect, double pageHeight) {
        return new Rect(rect.x(), pageHeight - rect.y() - rect.height(), rect.width(), rect.height());
    }

    /**
     * Conjugates a screen-space transform by the page flip {@code F = [1 0 0 -1 0 h]}, giving {@code F·M·F}.
     * Points are still flipped one by one when emitted, so the page itself keeps an unflipped base transform
     * and text stays upright.
     */
    public static Transform2D screenTransformToPdf(Transform2D matrix, double pageHeight) {
        return new Transform2D(
                matrix.a(),
                -matrix.b(),
                -matrix.c(),
                matrix.d(),
                matrix.tx() + matrix.c() * pageHeight,
                pageHeight * (1 - matrix.d()) - matrix.ty());
    }

    public static double mmToPoints(double mm) {
        return mm / MM_PER_INCH * POINTS_PER_INCH;
    }

    public static double pointsToMm(double points) {
        return points / POINTS_PER_INCH * MM_PER_INCH;
    }

    public static double inchesToPoints(double inches) {
        return inches * POINTS_PER_INCH;
    }

    public static double pixelsToPoints(double pixels, double dpi) {
        return pixels * POINTS_PER_INCH / dpi;
    }

    public static double pointsToPixels(double points, double dpi) {
        return points * dpi / POINTS_PER_INCH;
    }

    public static double convertDpi(double value, double fromDpi, double toDpi) {
        return value * toDpi / fromDpi;
    }
}
