package ir.ipaam.pdflayout.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import ir.ipaam.pdflayout.api.dto.DocumentRequest;
import ir.ipaam.pdflayout.api.dto.PageRequest;
import ir.ipaam.pdflayout.api.dto.WidgetSpec;
import ir.ipaam.pdflayout.config.PdfLayoutProperties;
import ir.ipaam.pdflayout.domain.document.Document;
import ir.ipaam.pdflayout.domain.font.StandardFontMetricsProvider;
import ir.ipaam.pdflayout.domain.geometry.Rect;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.theme.ThemeData;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentRenderServiceTest {

    private static final double LINE = 12 * 1.2;

    private PdfLayoutProperties properties;
    private DocumentRenderService service;

    @BeforeEach
    void setUp() {
        properties = new PdfLayoutProperties();
        service = new DocumentRenderService(properties, new StandardFontMetricsProvider(), ThemeData.defaults());
    }

    @Test
    void rendersJsonRequestIntoPages() throws IOException {
        DocumentRequest request = readFixture("/requests/invoice.json");

        Document document = service.render(request);
        byte[] pdf = document.save();

        assertEquals(2, document.getPageCount());
        assertThat(document.getPages().get(0).getSize()).isEqualTo(new Size(595, 842));
        assertThat(document.getPages().get(0).getContentArea()).isEqualTo(new Rect(36, 36, 523, 770));
        assertThat(document.getPages().get(1).getSize()).isEqualTo(new Size(300, 200));

        try (PDDocument parsed = Loader.loadPDF(pdf)) {
            assertEquals(2, parsed.getNumberOfPages());
            assertEquals("Invoice 1042", parsed.getDocumentInformation().getTitle());
            assertEquals("Billing", parsed.getDocumentInformation().getAuthor());
            String text = new PDFTextStripper().getText(parsed);
            assertThat(text).contains("Consulting services", "Hosting", "Total 1,500.00", "Thank you");
        }
    }

    @Test
    void pageWithoutContentUsesDefaults() {
        DocumentRequest request = new DocumentRequest();
        request.setPages(List.of(new PageRequest()));

        Document document = service.render(request);

        assertEquals(1, document.getPageCount());
        assertThat(document.getPages().get(0).getSize()).isEqualTo(new Size(612, 792));
        assertThat(document.getPages().get(0).getContentArea()).isEqualTo(new Rect(20, 20, 572, 752));
    }

    @Test
    void unknownPageFormatIsRejected() {
        PageRequest page = new PageRequest();
        page.setFormat("B9");
        DocumentRequest request = new DocumentRequest();
        request.setPages(List.of(page));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> service.render(request));
        assertThat(ex.getMessage()).contains("B9");
    }

    @Test
    void compressFlagOverridesConfiguration() {
        WidgetSpec.TextSpec text = new WidgetSpec.TextSpec();
        text.setText("Compressed body");
        PageRequest page = new PageRequest();
        page.setContent(text);
        DocumentRequest request = new DocumentRequest();
        request.setPages(List.of(page));

        String plain = new String(service.render(request).save(), StandardCharsets.ISO_8859_1);
        request.setCompress(true);
        String compressed = new String(service.render(request).save(), StandardCharsets.ISO_8859_1);

        assertThat(plain).contains("(Compressed body) Tj").doesNotContain("/FlateDecode");
        assertThat(compressed).contains("/FlateDecode").doesNotContain("(Compressed body) Tj");
    }

    @Test
    void splitsParagraphsOnBlankLines() {
        List<String> paragraphs = DocumentRenderService.splitParagraphs("a\nb\n\n  \nc\r\n\r\nd\n\n");

        assertThat(paragraphs).containsExactly("a b", "c", "d");
    }

    @Test
    void paginatesByWrappedHeight() {
        List<String> paragraphs = IntStream.rangeClosed(1, 12).mapToObj(i -> "Paragraph " + i).toList();

        List<List<String>> pages = service.paginate(paragraphs, new Size(572, 100));

        assertThat(pages).extracting(List::size).containsExactly(5, 5, 2);
        assertEquals("Paragraph 6", pages.get(1).get(0));
    }

    @Test
    void oversizedParagraphContinuesOnFollowingPages() {
        String longParagraph = "word ".repeat(400).strip();
        Size content = new Size(200, 100);

        List<List<String>> pages = service.paginate(List.of("intro", longParagraph, "outro"), content);

        assertThat(pages.size()).isGreaterThan(2);
        assertEquals("intro", pages.get(0).get(0));
        assertThat(pages.get(pages.size() - 1)).endsWith("outro");
        String rejoined = pages.stream()
                .flatMap(List::stream)
                .map(slice -> slice.replace('\n', ' '))
                .collect(Collectors.joining(" "));
        assertEquals("intro " + longParagraph + " outro", rejoined);
        for (List<String> page : pages) {
            int lines = page.stream().mapToInt(slice -> slice.split("\n").length).sum();
            double height = lines * LINE + DocumentRenderService.PARAGRAPH_SPACING * (page.size() - 1);
            assertThat(height).isLessThanOrEqualTo(content.height());
        }
    }

    @Test
    void longUploadKeepsEveryLineInsideContentArea() throws IOException {
        Document document = service.renderText("Lorem", "lorem ipsum dolor sit amet ".repeat(600), null, false);

        assertThat(document.getPageCount()).isGreaterThan(1);
        try (PDDocument parsed = Loader.loadPDF(document.save())) {
            BaselineCollector collector = new BaselineCollector();
            String text = collector.getText(parsed);

            assertEquals(600, text.split("lorem", -1).length - 1);
            assertThat(collector.baselines).isNotEmpty();
            assertThat(collector.baselines).allSatisfy(y -> assertThat(y).isBetween(20f, 772f));
        }
    }

    @Test
    void emptyTextStillProducesOnePage() {
        assertThat(service.paginate(List.of(), new Size(100, 100))).containsExactly(List.of());
        assertEquals(1, service.renderText("empty", "", null, false).getPageCount());
    }

    @Test
    void rendersTextAcrossPages() throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 1; i <= 80; i++) {
            lines.add("Line " + i + " of the report");
        }

        Document document = service.renderText("Report", String.join("\n\n", lines), "letter", false);

        assertEquals(3, document.getPageCount());
        try (PDDocument parsed = Loader.loadPDF(document.save())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(3);
            stripper.setEndPage(3);
            String lastPage = stripper.getText(parsed);
            assertTrue(lastPage.contains("Line 80 of the report"));
            assertThat(lastPage).doesNotContain("Line 1 of");
            assertEquals("Report", parsed.getDocumentInformation().getTitle());
        }
    }

    private DocumentRequest readFixture(String path) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(path)) {
            return new ObjectMapper().readValue(in, DocumentRequest.class);
        }
    }

    /**
     * Records the baseline of every extracted glyph, measured from the top of the page.
     */
    private static final class BaselineCollector extends PDFTextStripper {

        private final List<Float> baselines = new ArrayList<>();

        BaselineCollector() throws IOException {
            super();
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            textPositions.forEach(position -> baselines.add(position.getYDirAdj()));
            super.writeString(text, textPositions);
        }
    }
}
