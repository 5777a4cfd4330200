package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Axis;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.layout.IntrinsicDimension;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.experimental.SuperBuilder;

/**
 * Forces its child to the width it would take if unconstrained. Costs an extra layout pass of the child.
 */
@SuperBuilder
public class IntrinsicWidth extends BaseWidget {

    private final Widget child;
    private final Committed<ChildPlacement> placement = new Committed<>();

    public static IntrinsicWidth of(Widget child) {
        return IntrinsicWidth.builder().child(child).build();
    }

    @Override
    public LayoutResult layout(LayoutContext context) {
        BoxConstraints constraints = context.constraints();
        IntrinsicDimension intrinsic = context.solver().calculateIntrinsicDimensions(child, context, Axis.HORIZONTAL);
        double width = constraints.constrainWidth(intrinsic.max());

        LayoutResult result = context.layoutChild(child,
                new BoxConstraints(width, width, constraints.minHeight(), constraints.maxHeight()));
        placement.set(new ChildPlacement(child, result.size(), Point.ZERO));
        return result;
    }

    @Override
    public void paint(PaintContext context) {
        placement.get().paint(context);
    }
}
