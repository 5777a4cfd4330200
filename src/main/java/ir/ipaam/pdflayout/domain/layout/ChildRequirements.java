package ir.ipaam.pdflayout.domain.layout;

import lombok.Builder;

/**
 * Optional fixed size and min/max overrides a composite asks for on behalf of a child.
 */
@Builder
public record ChildRequirements(
        Double width,
        Double height,
        Double minWidth,
        Double maxWidth,
        Double minHeight,
        Double maxHeight) {

    public static ChildRequirements none() {
        return ChildRequirements.builder().build();
    }

    public static ChildRequirements fixed(Double width, Double height) {
        return ChildRequirements.builder().width(width).height(height).build();
    }
}
