package ir.ipaam.pdflayout.domain.graphics;

import ir.ipaam.pdflayout.domain.pdf.LineCap;
import ir.ipaam.pdflayout.domain.pdf.LineJoin;
import ir.ipaam.pdflayout.domain.pdf.PdfColor;
import ir.ipaam.pdflayout.domain.pdf.PdfFont;

/**
 * Drawing surface of a page. Coordinates are interpreted in the implementation's own space.
 */
public interface GraphicsContext {

    /**
     * Bezier control-point factor approximating a quarter circle.
     */
    double KAPPA = 0.5522847498;

    void saveContext();

    void restoreContext();

    int getStackDepth();

    void setTransform(Transform2D transform);

    Transform2D getTransform();

    void moveTo(double x, double y);

    void lineTo(double x, double y);

    void curveTo(double x1, double y1, double x2, double y2, double x3, double y3);

    void drawRect(double x, double y, double width, double height);

    void closePath();

    void fillPath(boolean evenOdd);

    void strokePath(boolean close);

    void fillAndStrokePath(boolean evenOdd, boolean close);

    void clipPath(boolean evenOdd, boolean end);

    void setLineWidth(double width);

    void setLineCap(LineCap cap);

    void setLineJoin(LineJoin join);

    void setFillColor(PdfColor color);

    void setStrokeColor(PdfColor color);

    void beginText();

    void endText();

    void moveTextPosition(double x, double y);

    void setFont(PdfFont font, double size);

    void showText(String text);

    void comment(String text);

    default void fillPath() {
        fillPath(false);
    }

    default void strokePath() {
        strokePath(false);
    }

    default void clipPath() {
        clipPath(false, true);
    }

    default void setColor(PdfColor color) {
        setFillColor(color);
        setStrokeColor(color);
    }

    default void drawLine(double x1, double y1, double x2, double y2) {
        moveTo(x1, y1);
        lineTo(x2, y2);
    }

    default void drawEllipse(double cx, double cy, double rx, double ry) {
        double ox = rx * KAPPA;
        double oy = ry * KAPPA;
        moveTo(cx + rx, cy);
        curveTo(cx + rx, cy + oy, cx + ox, cy + ry, cx, cy + ry);
        curveTo(cx - ox, cy + ry, cx - rx, cy + oy, cx - rx, cy);
        curveTo(cx - rx, cy - oy, cx - ox, cy - ry, cx, cy - ry);
        curveTo(cx + ox, cy - ry, cx + rx, cy - oy, cx + rx, cy);
        closePath();
    }

    default void drawRoundedRect(double x, double y, double width, double height, double radius) {
        double r = Math.max(0, Math.min(radius, Math.min(width, height) / 2));
        if (r == 0) {
            drawRect(x, y, width, height);
            return;
        }
        double k = r * (1 - KAPPA);
        double right = x + width;
        double bottom = y + height;
        moveTo(x + r, y);
        lineTo(right - r, y);
        curveTo(right - k, y, right, y + k, right, y + r);
        lineTo(right, bottom - r);
        curveTo(right, bottom - k, right - k, bottom, right - r, bottom);
        lineTo(x + r, bottom);
        curveTo(x + k, bottom, x, bottom - k, x, bottom - r);
        lineTo(x, y + r);
        curveTo(x, y + k, x + k, y, x + r, y);
        closePath();
    }

    default void drawString(PdfFont font, double size, String text, double x, double y) {
        beginText();
        setFont(font, size);
        moveTextPosition(x, y);
        showText(text);
        endText();
    }
}
