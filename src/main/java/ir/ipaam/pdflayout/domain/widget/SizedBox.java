package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.ChildRequirements;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.experimental.SuperBuilder;

/**
 * Box of a fixed width and/or height. Without a child it is empty space.
 */
@SuperBuilder
public class SizedBox extends BaseWidget {

    private final Double width;
    private final Double height;
    private final Widget child;
    private final Committed<ChildPlacement> placement = new Committed<>();

    public static SizedBox of(double width, double height) {
        return SizedBox.builder().width(width).height(height).build();
    }

    public static SizedBox of(double width, double height, Widget child) {
        return SizedBox.builder().width(width).height(height).child(child).build();
    }

    @Override
    public LayoutResult layout(LayoutContext context) {
        BoxConstraints childConstraints = context.solver()
                .propagateConstraints(context.constraints(), ChildRequirements.fixed(width, height));
        if (width != null) {
            childConstraints = new BoxConstraints(childConstraints.maxWidth(), childConstraints.maxWidth(),
                    childConstraints.minHeight(), childConstraints.maxHeight());
        }
        if (height != null) {
            childConstraints = new BoxConstraints(childConstraints.minWidth(), childConstraints.maxWidth(),
                    childConstraints.maxHeight(), childConstraints.maxHeight());
        }

        if (child == null) {
            return LayoutResult.of(childConstraints.constrain(new Size(
                    width != null ? width : 0,
                    height != null ? height : 0)));
        }

        LayoutResult result = context.layoutChild(child, childConstraints);
        placement.set(new ChildPlacement(child, result.size(), Point.ZERO));
        return result;
    }

    @Override
    public void paint(PaintContext context) {
        if (child != null) {
            placement.get().paint(context);
        }
    }
}
