package ir.ipaam.pdflayout.domain.pdf;

import lombok.Builder;

/**
 * @param version header version, e.g. {@code 1.4}
 * @param compress deflate content streams
 * @param verbose annotate content streams with comments
 */
@Builder
public record PdfDocumentSettings(String version, boolean compress, boolean verbose) {

    public PdfDocumentSettings {
        if (version == null || version.isBlank()) {
            version = "1.4";
        }
    }

    public static PdfDocumentSettings defaults() {
        return new PdfDocumentSettings("1.4", false, false);
    }
}
