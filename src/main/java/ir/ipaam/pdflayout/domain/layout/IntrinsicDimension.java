package ir.ipaam.pdflayout.domain.layout;

public record IntrinsicDimension(double min, double max) {
}
