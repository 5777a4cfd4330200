package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Rect;
import ir.ipaam.pdflayout.domain.graphics.GraphicsContext;
import ir.ipaam.pdflayout.domain.pdf.PdfColor;
import lombok.Builder;

/**
 * Background, border and uniform corner radius painted behind a box.
 */
@Builder
public record BoxDecoration(PdfColor color, BorderSide border, double borderRadius) {

    void paintBackground(GraphicsContext graphics, Rect rect) {
        if (color == null) {
            return;
        }
        graphics.setFillColor(color);
        outline(graphics, rect);
        graphics.fillPath();
    }

    void paintBorder(GraphicsContext graphics, Rect rect) {
        if (border == null || border.width() <= 0) {
            return;
        }
        double inset = border.width() / 2;
        graphics.setStrokeColor(border.color() != null ? border.color() : PdfColor.BLACK);
        graphics.setLineWidth(border.width());
        outline(graphics, new Rect(rect.x() + inset, rect.y() + inset,
                Math.max(0, rect.width() - border.width()), Math.max(0, rect.height() - border.width())));
        graphics.strokePath();
    }

    private void outline(GraphicsContext graphics, Rect rect) {
        if (borderRadius > 0) {
            graphics.drawRoundedRect(rect.x(), rect.y(), rect.width(), rect.height(), borderRadius);
        } else {
            graphics.drawRect(rect.x(), rect.y(), rect.width(), rect.height());
        }
    }
}
