package ir.ipaam.pdflayout.application.handler;

import ir.ipaam.pdflayout.api.dto.DocumentRequest;
import ir.ipaam.pdflayout.api.dto.PageRequest;
import ir.ipaam.pdflayout.api.dto.WidgetSpec;
import ir.ipaam.pdflayout.application.service.DocumentRenderService;
import ir.ipaam.pdflayout.config.PdfLayoutProperties;
import ir.ipaam.pdflayout.domain.command.RenderDocumentCommand;
import ir.ipaam.pdflayout.domain.command.RenderTextFileCommand;
import ir.ipaam.pdflayout.domain.dto.PdfGenerationResult;
import ir.ipaam.pdflayout.domain.font.StandardFontMetricsProvider;
import ir.ipaam.pdflayout.domain.theme.ThemeData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class DocumentCommandHandlerTest {

    private DocumentCommandHandler handler;

    @BeforeEach
    void setUp() {
        DocumentRenderService service = new DocumentRenderService(
                new PdfLayoutProperties(), new StandardFontMetricsProvider(), ThemeData.defaults());
        handler = new DocumentCommandHandler(service);
    }

    @Test
    void rendersDocumentCommand() {
        WidgetSpec.TextSpec text = new WidgetSpec.TextSpec();
        text.setText("Quarterly numbers");
        PageRequest page = new PageRequest();
        page.setContent(text);
        DocumentRequest request = new DocumentRequest();
        request.setTitle("Q1: report");
        request.setPages(List.of(page, new PageRequest()));

        PdfGenerationResult result = handler.handle(new RenderDocumentCommand("req-1", request));

        assertNotNull(result);
        assertEquals("Q1_ report.pdf", result.fileName());
        assertEquals(2, result.pageCount());
        assertThat(new String(result.pdfBytes(), 0, 8, StandardCharsets.ISO_8859_1)).isEqualTo("%PDF-1.4");
    }

    @Test
    void rendersTextFileCommandNamedAfterUpload() {
        PdfGenerationResult result = handler.handle(
                new RenderTextFileCommand("req-2", "notes.txt", "Hello\n\nWorld", null, false));

        assertEquals("notes.pdf", result.fileName());
        assertEquals(1, result.pageCount());
    }

    @Test
    void fallsBackToRequestIdWithoutTitle() {
        assertEquals("req-3.pdf", DocumentCommandHandler.resolveFileName(null, "req-3"));
        assertEquals("req-3.pdf", DocumentCommandHandler.resolveFileName("   ", "req-3"));
        assertEquals("a_b_c.pdf", DocumentCommandHandler.resolveFileName("a/b\\c", "req-3"));
    }
}
