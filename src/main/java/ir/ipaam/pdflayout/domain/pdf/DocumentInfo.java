package ir.ipaam.pdflayout.domain.pdf;

import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Metadata written to the document information dictionary.
 */
@Builder
public record DocumentInfo(
        String title,
        String author,
        String subject,
        String keywords,
        String creator,
        String producer,
        LocalDateTime creationDate) {

    public static DocumentInfo empty() {
        return DocumentInfo.builder().build();
    }
}
