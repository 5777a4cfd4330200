package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.font.FontMetricsProvider;
import ir.ipaam.pdflayout.domain.font.StandardFontMetricsProvider;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.graphics.ScreenGraphics;
import ir.ipaam.pdflayout.domain.pdf.PdfDocument;
import ir.ipaam.pdflayout.domain.theme.ThemeData;

/**
 * Shared fixtures for layout tests.
 */
public final class TestLayouts {

    public static final FontMetricsProvider METRICS = new StandardFontMetricsProvider();

    private TestLayouts() {
    }

    public static LayoutContext context(BoxConstraints constraints) {
        return context(constraints, new ConstraintSolver());
    }

    public static LayoutContext context(BoxConstraints constraints, ConstraintSolver solver) {
        return new LayoutContext(constraints, TextDirection.LTR, ThemeData.defaults(), METRICS, solver);
    }

    public static LayoutContext rtl(BoxConstraints constraints) {
        return context(constraints).withTextDirection(TextDirection.RTL);
    }

    /**
     * Lays {@code widget} out under {@code constraints} and paints it onto a scratch page, returning the layout.
     */
    public static LayoutResult layoutAndPaint(Widget widget, BoxConstraints constraints) {
        ConstraintSolver solver = new ConstraintSolver();
        LayoutResult result = solver.solveLayout(widget, context(constraints, solver), LayoutOptions.UNCACHED);
        paint(widget, result.size());
        return result;
    }

    public static PdfDocument paint(Widget widget, Size size) {
        PdfDocument document = new PdfDocument();
        Size page = new Size(1000, 1000);
        ScreenGraphics graphics = new ScreenGraphics(document.addPage(page.width(), page.height()).getGraphics(),
                page.height());
        widget.paint(new PaintContext(size, ThemeData.defaults(), graphics, document.getFontRegistry(),
                new PageGeometry(page, EdgeInsets.ZERO)));
        return document;
    }

    /**
     * Leaf that asks for a fixed size, clamped to its constraints, and counts how often it is laid out.
     */
    public static final class FixedBox implements Widget {

        private final String key;
        private final Size preferred;
        private int layoutCount;
        private int paintCount;
        private Point paintOrigin;
        private Size paintSize;

        public FixedBox(String key, double width, double height) {
            this.key = key;
            this.preferred = new Size(width, height);
        }

        @Override
        public LayoutResult layout(LayoutContext context) {
            layoutCount++;
            return LayoutResult.of(context.constraints().constrain(preferred));
        }

        @Override
        public void paint(PaintContext context) {
            paintCount++;
            paintOrigin = context.graphics().getTransform().getTranslation();
            paintSize = context.size();
        }

        @Override
        public String getKey() {
            return key;
        }

        public int getLayoutCount() {
            return layoutCount;
        }

        public int getPaintCount() {
            return paintCount;
        }

        /** Page-relative top-left corner this box was painted at. */
        public Point getPaintOrigin() {
            return paintOrigin;
        }

        public Size getPaintSize() {
            return paintSize;
        }
    }

    /**
     * Leaf that ignores its constraints and always reports the same size.
     */
    public static final class StubbornBox implements Widget {

        private final Size size;

        public StubbornBox(double width, double height) {
            this.size = new Size(width, height);
        }

        @Override
        public LayoutResult layout(LayoutContext context) {
            return LayoutResult.of(size);
        }

        @Override
        public void paint(PaintContext context) {
        }
    }
}
