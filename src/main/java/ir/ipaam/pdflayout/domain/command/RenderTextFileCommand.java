package ir.ipaam.pdflayout.domain.command;

import java.util.Objects;

/**
 * Renders a plain-text upload as a flowing column of paragraphs.
 */
public record RenderTextFileCommand(String requestId, String fileName, String text, String format, boolean rtl) {

    public RenderTextFileCommand {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(text, "text");
    }
}
