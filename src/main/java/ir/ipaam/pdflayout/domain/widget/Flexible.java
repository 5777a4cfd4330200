package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.Builder;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

/**
 * Marks a child of a {@link Flex} as taking a share of the free main-axis space, proportional to {@code flex}.
 * Outside a flex it is transparent.
 */
@SuperBuilder
public class Flexible extends BaseWidget {

    @Getter
    @Builder.Default
    private final int flex = 1;
    @Getter
    @Builder.Default
    private final FlexFit fit = FlexFit.LOOSE;
    @Getter
    private final Widget child;
    private final Committed<ChildPlacement> placement = new Committed<>();

    @Override
    public LayoutResult layout(LayoutContext context) {
        LayoutResult result = context.layoutChild(child, context.constraints());
        placement.set(new ChildPlacement(child, result.size(), Point.ZERO));
        return result;
    }

    @Override
    public void paint(PaintContext context) {
        placement.get().paint(context);
    }
}
