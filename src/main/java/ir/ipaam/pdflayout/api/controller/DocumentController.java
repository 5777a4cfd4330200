package ir.ipaam.pdflayout.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import ir.ipaam.pdflayout.api.dto.DocumentRequest;
import ir.ipaam.pdflayout.api.dto.PageFormatResponse;
import ir.ipaam.pdflayout.application.util.TextFileDecoder;
import ir.ipaam.pdflayout.domain.command.RenderDocumentCommand;
import ir.ipaam.pdflayout.domain.command.RenderTextFileCommand;
import ir.ipaam.pdflayout.domain.document.PageFormat;
import ir.ipaam.pdflayout.domain.dto.PdfGenerationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.axonframework.commandhandling.gateway.CommandGateway;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    static final String PAGE_COUNT_HEADER = "X-Page-Count";

    private final CommandGateway commandGateway;

    @Operation(summary = "Lay out a widget tree per page and return the resulting PDF")
    @PostMapping(value = "/render", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_PDF_VALUE)
    public ResponseEntity<byte[]> render(@Valid @RequestBody DocumentRequest request) {
        PdfGenerationResult result = commandGateway.sendAndWait(
                new RenderDocumentCommand(UUID.randomUUID().toString(), request));
        return buildPdfResponse(result);
    }

    @Operation(summary = "Render an uploaded plain-text file as paragraphs")
    @PostMapping(value = "/render/text", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_PDF_VALUE)
    public ResponseEntity<byte[]> renderText(@RequestPart("file") MultipartFile file,
                                             @RequestParam(value = "format", required = false) String format,
                                             @RequestParam(value = "rtl", defaultValue = "false") boolean rtl) throws IOException {
        String text = TextFileDecoder.decode(file.getBytes());
        PdfGenerationResult result = commandGateway.sendAndWait(new RenderTextFileCommand(
                UUID.randomUUID().toString(), file.getOriginalFilename(), text, format, rtl));
        return buildPdfResponse(result);
    }

    @Operation(summary = "List the supported page formats in points")
    @GetMapping("/formats")
    public List<PageFormatResponse> formats() {
        return Arrays.stream(PageFormat.values())
                .map(format -> new PageFormatResponse(format.name(), format.getWidth(), format.getHeight()))
                .toList();
    }

    private ResponseEntity<byte[]> buildPdfResponse(PdfGenerationResult result) {
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(result.fileName(), StandardCharsets.UTF_8)
                .build();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(disposition);
        headers.setContentType(MediaType.APPLICATION_PDF);
        headers.add(PAGE_COUNT_HEADER, String.valueOf(result.pageCount()));

        return ResponseEntity.ok()
                .headers(headers)
                .body(result.pdfBytes());
    }
}
