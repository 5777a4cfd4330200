package ir.ipaam.pdflayout.api.dto;

public record PageFormatResponse(String name, double width, double height) {
}
