package ir.ipaam.pdflayout.application.service;

import ir.ipaam.pdflayout.api.dto.DocumentRequest;
import ir.ipaam.pdflayout.api.dto.PageRequest;
import ir.ipaam.pdflayout.api.mapper.WidgetSpecMapper;
import ir.ipaam.pdflayout.config.PdfLayoutProperties;
import ir.ipaam.pdflayout.domain.document.Document;
import ir.ipaam.pdflayout.domain.document.DocumentOptions;
import ir.ipaam.pdflayout.domain.document.PageFormat;
import ir.ipaam.pdflayout.domain.document.PageOptions;
import ir.ipaam.pdflayout.domain.font.FontMetricsProvider;
import ir.ipaam.pdflayout.domain.font.StandardFont;
import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.LayoutTimings;
import ir.ipaam.pdflayout.domain.layout.TextDirection;
import ir.ipaam.pdflayout.domain.layout.Widget;
import ir.ipaam.pdflayout.domain.pdf.DocumentInfo;
import ir.ipaam.pdflayout.domain.pdf.PdfDocumentSettings;
import ir.ipaam.pdflayout.domain.theme.TextStyle;
import ir.ipaam.pdflayout.domain.theme.ThemeData;
import ir.ipaam.pdflayout.domain.util.BidiTextUtils;
import ir.ipaam.pdflayout.domain.util.TextWrapUtils;
import ir.ipaam.pdflayout.domain.widget.Column;
import ir.ipaam.pdflayout.domain.widget.CrossAxisAlignment;
import ir.ipaam.pdflayout.domain.widget.MainAxisSize;
import ir.ipaam.pdflayout.domain.widget.Text;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link Document} from a request and serializes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentRenderService {

    static final double PARAGRAPH_SPACING = 6;

    private final PdfLayoutProperties properties;
    private final FontMetricsProvider fontMetrics;
    private final ThemeData theme;

    public Document render(DocumentRequest request) {
        ThemeData documentTheme = request.getDefaultTextStyle() != null
                ? theme.withDefaultTextStyle(WidgetSpecMapper.toTextStyle(request.getDefaultTextStyle()))
                : theme;
        LayoutTimings timings = new LayoutTimings();
        Document document = new Document(options(request, documentTheme, timings));

        for (PageRequest page : request.getPages()) {
            Widget root = WidgetSpecMapper.toWidget(page.getContent());
            document.addPage(PageOptions.builder()
                    .format(resolveFormat(page.getFormat()))
                    .width(page.getWidth())
                    .height(page.getHeight())
                    .landscape(page.isLandscape())
                    .margins(page.getMargins() != null
                            ? WidgetSpecMapper.toEdgeInsets(page.getMargins())
                            : EdgeInsets.all(properties.getDefaultMargin()))
                    .textDirection(page.isRtl() ? TextDirection.RTL : TextDirection.LTR)
                    .build(root != null ? () -> root : null)
                    .build());
        }

        log.info("Rendered {} page(s), {} layout pass(es)", document.getPageCount(), timings.totalLayouts());
        if (log.isDebugEnabled()) {
            log.debug("Layout timings:\n{}", timings.report());
        }
        return document;
    }

    public Document renderText(String title, String text, String format, boolean rtl) {
        Document document = new Document(DocumentOptions.builder()
                .info(DocumentInfo.builder().title(title).producer(properties.getProducer()).build())
                .settings(settings(null))
                .theme(theme)
                .fontMetrics(fontMetrics)
                .layoutCache(properties.isLayoutCache())
                .build());

        PageFormat pageFormat = resolveFormat(format);
        EdgeInsets margins = EdgeInsets.all(properties.getDefaultMargin());
        Size content = margins.deflateSize(pageFormat.getSize());
        TextDirection direction = rtl || BidiTextUtils.containsRtl(text) ? TextDirection.RTL : TextDirection.LTR;

        for (List<String> chunk : paginate(splitParagraphs(text), content)) {
            List<Widget> children = new ArrayList<>();
            chunk.forEach(paragraph -> children.add(Text.of(paragraph)));
            Widget column = Column.builder()
                    .children(children)
                    .crossAxisAlignment(CrossAxisAlignment.START)
                    .mainAxisSize(MainAxisSize.MIN)
                    .spacing(PARAGRAPH_SPACING)
                    .build();
            document.addPage(PageOptions.builder()
                    .format(pageFormat)
                    .margins(margins)
                    .textDirection(direction)
                    .build(() -> column)
                    .build());
        }
        log.info("Rendered text file into {} page(s)", document.getPageCount());
        return document;
    }

    /**
     * Greedily packs paragraphs onto pages using the same line breaks {@link Text} produces. A paragraph that does
     * not fit the rest of a page continues on the next one, so each entry is a slice of wrapped lines joined with
     * newlines.
     */
    List<List<String>> paginate(List<String> paragraphs, Size content) {
        TextStyle style = theme.defaultTextStyle();
        StandardFont font = style.resolveFont();
        double fontSize = style.fontSizeOrDefault();
        double lineHeight = fontSize * style.lineHeightOrDefault();

        List<List<String>> pages = new ArrayList<>();
        List<String> current = new ArrayList<>();
        double used = 0;
        for (String paragraph : paragraphs) {
            List<String> lines = TextWrapUtils.breakLines(paragraph, content.width(), true, fontMetrics, font, fontSize);
            int next = 0;
            while (next < lines.size()) {
                double gap = current.isEmpty() ? 0 : PARAGRAPH_SPACING;
                // strict fit, Column sums may drift by rounding
                int fitting = TextWrapUtils.fittingLines(content.height() - used - gap - 1e-5, lineHeight);
                if (fitting <= 0) {
                    if (!current.isEmpty()) {
                        pages.add(current);
                        current = new ArrayList<>();
                        used = 0;
                        continue;
                    }
                    // page shorter than one line
                    fitting = 1;
                }
                int take = Math.min(fitting, lines.size() - next);
                current.add(String.join("\n", lines.subList(next, next + take)));
                used += gap + take * lineHeight;
                next += take;
                if (next < lines.size()) {
                    pages.add(current);
                    current = new ArrayList<>();
                    used = 0;
                }
            }
        }
        if (!current.isEmpty() || pages.isEmpty()) {
            pages.add(current);
        }
        log.debug("Packed {} paragraph(s) onto {} page(s)", paragraphs.size(), pages.size());
        return pages;
    }

    private DocumentOptions options(DocumentRequest request, ThemeData documentTheme, LayoutTimings timings) {
        return DocumentOptions.builder()
                .info(DocumentInfo.builder()
                        .title(request.getTitle())
                        .author(request.getAuthor())
                        .subject(request.getSubject())
                        .keywords(request.getKeywords())
                        .creator(request.getCreator())
                        .producer(properties.getProducer())
                        .build())
                .settings(settings(request.getCompress()))
                .theme(documentTheme)
                .fontMetrics(fontMetrics)
                .instrumentation(timings)
                .layoutCache(properties.isLayoutCache())
                .build();
    }

    private PdfDocumentSettings settings(Boolean compress) {
        return PdfDocumentSettings.builder()
                .version(properties.getPdfVersion())
                .compress(compress != null ? compress : properties.isCompress())
                .verbose(properties.isVerbose())
                .build();
    }

    private PageFormat resolveFormat(String format) {
        return PageFormat.fromName(format != null && !format.isBlank() ? format : properties.getDefaultFormat());
    }

    static List<String> splitParagraphs(String text) {
        List<String> paragraphs = new ArrayList<>();
        for (String block : text.replace("\r\n", "\n").split("\n\\s*\n")) {
            String paragraph = block.replace('\n', ' ').strip();
            if (!paragraph.isEmpty()) {
                paragraphs.add(paragraph);
            }
        }
        return paragraphs;
    }
}
