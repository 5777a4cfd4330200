package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.geometry.Size;

import java.util.Objects;

/**
 * Outcome of a layout call. A {@code null} baseline means the node has no text anchor.
 */
public record LayoutResult(Size size, Double baseline, boolean needsRepaint) {

    public LayoutResult {
        Objects.requireNonNull(size, "size");
    }

    public static LayoutResult of(Size size) {
        return new LayoutResult(size, null, true);
    }

    public static LayoutResult of(Size size, Double baseline) {
        return new LayoutResult(size, baseline, true);
    }

    public boolean hasBaseline() {
        return baseline != null;
    }
}
