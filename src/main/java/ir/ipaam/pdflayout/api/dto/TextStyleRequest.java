package ir.ipaam.pdflayout.api.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class TextStyleRequest {

    private String fontFamily;
    @Positive
    private Double fontSize;
    private Boolean bold;
    private Boolean italic;
    /** Hex colour, {@code #RGB}, {@code #RRGGBB} or {@code #AARRGGBB}. */
    private String color;
    @Positive
    private Double lineHeight;
    private Boolean underline;
}
