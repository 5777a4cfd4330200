package ir.ipaam.pdflayout.domain.pdf;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public class PdfInfo extends PdfObject {

    private static final DateTimeFormatter PDF_DATE = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    public PdfInfo(PdfDocument document, DocumentInfo info) {
        super(document, null);
        putIfPresent("/Title", info.title());
        putIfPresent("/Author", info.author());
        putIfPresent("/Subject", info.subject());
        putIfPresent("/Keywords", info.keywords());
        putIfPresent("/Creator", info.creator());
        putIfPresent("/Producer", info.producer());
        LocalDateTime created = info.creationDate() != null ? info.creationDate() : LocalDateTime.now();
        params.put("/CreationDate", PdfString.of("D:" + PDF_DATE.format(created)));
    }

    private void putIfPresent(String key, String value) {
        if (value != null && !value.isBlank()) {
            params.put(key, PdfString.of(value));
        }
    }
}
