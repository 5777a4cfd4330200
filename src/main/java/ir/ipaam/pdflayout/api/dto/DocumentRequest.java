package ir.ipaam.pdflayout.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DocumentRequest {

    private String title;
    private String author;
    private String subject;
    private String keywords;
    private String creator;

    /**
     * Deflate page content streams. Falls back to the service default when absent.
     */
    private Boolean compress;

    private TextStyleRequest defaultTextStyle;

    @Valid
    @NotEmpty(message = "At least one page is required")
    private List<PageRequest> pages = new ArrayList<>();
}
