package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.font.FontMetricsProvider;
import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.ConstraintSolver;
import ir.ipaam.pdflayout.domain.layout.PageGeometry;
import ir.ipaam.pdflayout.domain.layout.Widget;
import ir.ipaam.pdflayout.domain.pdf.FontRegistry;
import ir.ipaam.pdflayout.domain.pdf.PdfDocument;
import ir.ipaam.pdflayout.domain.pdf.PdfPage;
import ir.ipaam.pdflayout.domain.theme.ThemeData;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A paginated document built from widget trees. Owns its pages, its font resources and one constraint solver.
 * <p>
 * Not thread-safe; use one instance per thread.
 */
@Slf4j
public class Document {

    private final PdfDocument pdfDocument;
    private final ConstraintSolver solver;
    private final ThemeData theme;
    private final FontMetricsProvider fontMetrics;
    private final boolean layoutCacheEnabled;
    private final List<Page> pages = new ArrayList<>();

    public Document() {
        this(DocumentOptions.builder().build());
    }

    public Document(DocumentOptions options) {
        this.pdfDocument = new PdfDocument(options.getSettings(), options.getInfo());
        this.solver = new ConstraintSolver(options.getInstrumentation());
        this.theme = options.getTheme();
        this.fontMetrics = options.getFontMetrics();
        this.layoutCacheEnabled = options.isLayoutCache();
    }

    public Page addPage() {
        return addPage(PageOptions.builder().build());
    }

    /**
     * Creates a page and, when the options carry a builder, lays out and paints its root widget right away.
     */
    public Page addPage(PageOptions options) {
        Size size = options.resolveSize();
        EdgeInsets margins = options.getMargins() != null ? options.getMargins() : EdgeInsets.all(PageOptions.DEFAULT_MARGIN);
        if (margins.horizontal() > size.width() || margins.vertical() > size.height()) {
            throw new IllegalArgumentException("Margins " + margins + " leave no content area on a "
                    + size.width() + "x" + size.height() + " page");
        }

        PdfPage pdfPage = pdfDocument.addPage(size.width(), size.height());
        ThemeData pageTheme = options.getTheme() != null ? options.getTheme() : theme;
        Page page = new Page(this, pdfPage, new PageGeometry(size, margins), pageTheme);
        pages.add(page);
        log.debug("Added page {} of {}x{}", pages.size(), size.width(), size.height());

        if (options.getBuild() != null) {
            Widget root = options.getBuild().get();
            if (root != null) {
                page.renderWidget(root, options.getTextDirection());
            }
        }
        return page;
    }

    public byte[] save() {
        byte[] bytes = pdfDocument.save();
        log.debug("Saved document with {} pages, {} bytes", pages.size(), bytes.length);
        return bytes;
    }

    public List<Page> getPages() {
        return Collections.unmodifiableList(pages);
    }

    public int getPageCount() {
        return pages.size();
    }

    public ConstraintSolver getSolver() {
        return solver;
    }

    public FontRegistry getFontRegistry() {
        return pdfDocument.getFontRegistry();
    }

    public FontMetricsProvider getFontMetrics() {
        return fontMetrics;
    }

    public ThemeData getTheme() {
        return theme;
    }

    public boolean isLayoutCacheEnabled() {
        return layoutCacheEnabled;
    }

    public PdfDocument getPdfDocument() {
        return pdfDocument;
    }
}
