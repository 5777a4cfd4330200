package ir.ipaam.pdflayout.domain.command;

import ir.ipaam.pdflayout.api.dto.DocumentRequest;

import java.util.Objects;

public record RenderDocumentCommand(String requestId, DocumentRequest request) {

    public RenderDocumentCommand {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(request, "request");
    }
}
