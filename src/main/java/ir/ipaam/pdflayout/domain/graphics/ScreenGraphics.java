package ir.ipaam.pdflayout.domain.graphics;

import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Rect;
import ir.ipaam.pdflayout.domain.pdf.LineCap;
import ir.ipaam.pdflayout.domain.pdf.LineJoin;
import ir.ipaam.pdflayout.domain.pdf.PdfColor;
import ir.ipaam.pdflayout.domain.pdf.PdfFont;

/**
 * Top-left origin, Y-down view over a PDF surface. Every coordinate is flipped against the page height as the
 * operator is emitted and transforms are conjugated by the same flip.
 * <p>
 * Text positions are absolute: {@link #moveTextPosition(double, double)} is meant to be called once per
 * text object, which is what {@link #drawString} does.
 */
public class ScreenGraphics implements GraphicsContext {

    private final GraphicsContext target;
    private final double pageHeight;
    private final TransformStack transforms = new TransformStack();

    public ScreenGraphics(GraphicsContext target, double pageHeight) {
        this.target = target;
        this.pageHeight = pageHeight;
    }

    public double getPageHeight() {
        return pageHeight;
    }

    @Override
    public void saveContext() {
        target.saveContext();
        transforms.push(Transform2D.IDENTITY);
    }

    @Override
    public void restoreContext() {
        target.restoreContext();
        transforms.pop();
    }

    @Override
    public int getStackDepth() {
        return target.getStackDepth();
    }

    @Override
    public void setTransform(Transform2D transform) {
        target.setTransform(CoordinateSpace.screenTransformToPdf(transform, pageHeight));
        transforms.apply(transform);
    }

    /**
     * Accumulated screen-space transform set since the page root.
     */
    @Override
    public Transform2D getTransform() {
        return transforms.current();
    }

    @Override
    public void moveTo(double x, double y) {
        Point p = flip(x, y);
        target.moveTo(p.x(), p.y());
    }

    @Override
    public void lineTo(double x, double y) {
        Point p = flip(x, y);
        target.lineTo(p.x(), p.y());
    }

    @Override
    public void curveTo(double x1, double y1, double x2, double y2, double x3, double y3) {
        Point p1 = flip(x1, y1);
        Point p2 = flip(x2, y2);
        Point p3 = flip(x3, y3);
        target.curveTo(p1.x(), p1.y(), p2.x(), p2.y(), p3.x(), p3.y());
    }

    @Override
    public void drawRect(double x, double y, double width, double height) {
        Rect rect = CoordinateSpace.screenRectToPdf(new Rect(x, y, width, height), pageHeight);
        target.drawRect(rect.x(), rect.y(), rect.width(), rect.height());
    }

    @Override
    public void closePath() {
        target.closePath();
    }

    @Override
    public void fillPath(boolean evenOdd) {
        target.fillPath(evenOdd);
    }

    @Override
    public void strokePath(boolean close) {
        target.strokePath(close);
    }

    @Override
    public void fillAndStrokePath(boolean evenOdd, boolean close) {
        target.fillAndStrokePath(evenOdd, close);
    }

    @Override
    public void clipPath(boolean evenOdd, boolean end) {
        target.clipPath(evenOdd, end);
    }

    @Override
    public void setLineWidth(double width) {
        target.setLineWidth(width);
    }

    @Override
    public void setLineCap(LineCap cap) {
        target.setLineCap(cap);
    }

    @Override
    public void setLineJoin(LineJoin join) {
        target.setLineJoin(join);
    }

    @Override
    public void setFillColor(PdfColor color) {
        target.setFillColor(color);
    }

    @Override
    public void setStrokeColor(PdfColor color) {
        target.setStrokeColor(color);
    }

    @Override
    public void beginText() {
        target.beginText();
    }

    @Override
    public void endText() {
        target.endText();
    }

    @Override
    public void moveTextPosition(double x, double y) {
        Point p = flip(x, y);
        target.moveTextPosition(p.x(), p.y());
    }

    @Override
    public void setFont(PdfFont font, double size) {
        target.setFont(font, size);
    }

    @Override
    public void showText(String text) {
        target.showText(text);
    }

    @Override
    public void comment(String text) {
        target.comment(text);
    }

    private Point flip(double x, double y) {
        return CoordinateSpace.screenToPdf(new Point(x, y), pageHeight);
    }
}
