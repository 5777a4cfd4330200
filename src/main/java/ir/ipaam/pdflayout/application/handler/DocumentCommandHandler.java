package ir.ipaam.pdflayout.application.handler;

import ir.ipaam.pdflayout.application.service.DocumentRenderService;
import ir.ipaam.pdflayout.domain.command.RenderDocumentCommand;
import ir.ipaam.pdflayout.domain.command.RenderTextFileCommand;
import ir.ipaam.pdflayout.domain.document.Document;
import ir.ipaam.pdflayout.domain.dto.PdfGenerationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.axonframework.commandhandling.CommandHandler;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentCommandHandler {

    private final DocumentRenderService renderService;

    @CommandHandler
    public PdfGenerationResult handle(RenderDocumentCommand command) {
        log.debug("Rendering document request {}", command.requestId());
        Document document = renderService.render(command.request());
        byte[] pdf = document.save();
        String fileName = resolveFileName(command.request().getTitle(), command.requestId());
        return new PdfGenerationResult(fileName, pdf, document.getPageCount());
    }

    @CommandHandler
    public PdfGenerationResult handle(RenderTextFileCommand command) {
        log.debug("Rendering text upload {}", command.requestId());
        String title = baseName(command.fileName());
        Document document = renderService.renderText(title, command.text(), command.format(), command.rtl());
        byte[] pdf = document.save();
        return new PdfGenerationResult(resolveFileName(title, command.requestId()), pdf, document.getPageCount());
    }

    static String resolveFileName(String title, String fallback) {
        String base = title == null ? "" : title.strip().replaceAll("[\\\\/:*?\"<>|]", "_");
        return (base.isEmpty() ? fallback : base) + ".pdf";
    }

    private static String baseName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return null;
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
