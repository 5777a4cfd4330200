package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.exception.UnbalancedGraphicsStateException;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.geometry.Rect;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.graphics.ScreenGraphics;
import ir.ipaam.pdflayout.domain.graphics.Transform2D;
import ir.ipaam.pdflayout.domain.layout.ConstraintSolver;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutOptions;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PageGeometry;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.TextDirection;
import ir.ipaam.pdflayout.domain.layout.Widget;
import ir.ipaam.pdflayout.domain.pdf.PdfColor;
import ir.ipaam.pdflayout.domain.pdf.PdfFont;
import ir.ipaam.pdflayout.domain.pdf.PdfPage;
import ir.ipaam.pdflayout.domain.theme.TextStyle;
import ir.ipaam.pdflayout.domain.theme.ThemeData;
import lombok.extern.slf4j.Slf4j;

/**
 * A page of a {@link Document}. Size and margins are fixed at creation; drawing goes through a top-left origin
 * surface.
 */
@Slf4j
public class Page {

    private final Document document;
    private final PdfPage pdfPage;
    private final PageGeometry geometry;
    private final ThemeData theme;
    private ScreenGraphics graphics;

    Page(Document document, PdfPage pdfPage, PageGeometry geometry, ThemeData theme) {
        this.document = document;
        this.pdfPage = pdfPage;
        this.geometry = geometry;
        this.theme = theme;
    }

    public Size getSize() {
        return geometry.pageSize();
    }

    public EdgeInsets getMargins() {
        return geometry.margins();
    }

    public Rect getContentArea() {
        return geometry.contentArea();
    }

    public PdfPage getPdfPage() {
        return pdfPage;
    }

    public ScreenGraphics getGraphics() {
        if (graphics == null) {
            graphics = new ScreenGraphics(pdfPage.getGraphics(), geometry.pageSize().height());
        }
        return graphics;
    }

    public LayoutResult renderWidget(Widget root) {
        return renderWidget(root, TextDirection.LTR);
    }

    /**
     * Lays {@code root} out in the content area and paints it. Layout completes before any paint starts.
     */
    public LayoutResult renderWidget(Widget root, TextDirection textDirection) {
        ConstraintSolver solver = document.getSolver();
        Rect content = geometry.contentArea();
        LayoutContext context = new LayoutContext(
                BoxConstraints.loose(content.size()), textDirection, theme, document.getFontMetrics(), solver);

        solver.clearCacheForWidget(root);
        LayoutOptions options = document.isLayoutCacheEnabled() ? LayoutOptions.DEFAULT : LayoutOptions.UNCACHED;
        LayoutResult result = solver.solveLayout(root, context, options);
        log.debug("Laid out {} at {}x{} on page {}", ConstraintSolver.widgetId(root),
                result.size().width(), result.size().height(), pdfPage.getSerial());

        ScreenGraphics surface = getGraphics();
        int depth = surface.getStackDepth();
        surface.saveContext();
        surface.drawRect(content.x(), content.y(), content.width(), content.height());
        surface.clipPath();
        surface.setTransform(Transform2D.translation(content.x(), content.y()));
        root.paint(new PaintContext(result.size(), theme, surface, document.getFontRegistry(), geometry));
        surface.restoreContext();
        if (surface.getStackDepth() != depth) {
            throw new UnbalancedGraphicsStateException(ConstraintSolver.widgetId(root), depth, surface.getStackDepth());
        }
        return result;
    }

    /**
     * Draws a single line of text with its baseline at {@code (x, y)} from the page's top-left corner.
     */
    public void drawText(String text, double x, double y, TextStyle style) {
        TextStyle resolved = theme.defaultTextStyle().merge(style);
        PdfFont font = document.getFontRegistry().getFont(resolved.resolveFont());
        ScreenGraphics surface = getGraphics();
        surface.saveContext();
        surface.setFillColor(resolved.color() != null ? resolved.color() : PdfColor.BLACK);
        surface.drawString(font, resolved.fontSizeOrDefault(), text, x, y);
        surface.restoreContext();
    }

    public void drawRect(double x, double y, double width, double height, PdfColor fill, PdfColor stroke) {
        ScreenGraphics surface = getGraphics();
        surface.saveContext();
        if (fill != null) {
            surface.setFillColor(fill);
        }
        if (stroke != null || fill == null) {
            surface.setStrokeColor(stroke != null ? stroke : PdfColor.BLACK);
        }
        surface.drawRect(x, y, width, height);
        if (fill != null && stroke != null) {
            surface.fillAndStrokePath(false, false);
        } else if (fill != null) {
            surface.fillPath();
        } else {
            surface.strokePath();
        }
        surface.restoreContext();
    }
}
