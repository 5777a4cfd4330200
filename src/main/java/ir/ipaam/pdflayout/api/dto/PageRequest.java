package ir.ipaam.pdflayout.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class PageRequest {

    /**
     * One of A3, A4, A5, LETTER or LEGAL. Ignored when width and height are given.
     */
    private String format;

    @Positive
    private Double width;

    @Positive
    private Double height;

    private boolean landscape;

    @Valid
    private EdgeInsetsRequest margins;

    private boolean rtl;

    @Valid
    private WidgetSpec content;
}
