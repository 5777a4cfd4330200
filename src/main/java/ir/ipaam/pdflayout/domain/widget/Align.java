package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Alignment;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.Builder;
import lombok.experimental.SuperBuilder;

/**
 * Positions its child inside itself. On a bounded axis without a size factor it takes all available space,
 * otherwise it is the child's extent times the factor.
 */
@SuperBuilder
public class Align extends BaseWidget {

    @Builder.Default
    private final Alignment alignment = Alignment.CENTER;
    private final Double widthFactor;
    private final Double heightFactor;
    private final Widget child;
    private final Committed<ChildPlacement> placement = new Committed<>();

    public static Align of(Alignment alignment, Widget child) {
        return Align.builder().alignment(alignment).child(child).build();
    }

    @Override
    public LayoutResult layout(LayoutContext context) {
        BoxConstraints constraints = context.constraints();
        if (child == null) {
            return LayoutResult.of(new Size(
                    constraints.hasBoundedWidth() ? constraints.maxWidth() : constraints.minWidth(),
                    constraints.hasBoundedHeight() ? constraints.maxHeight() : constraints.minHeight()));
        }

        LayoutResult result = context.layoutChild(child, constraints.loosen());
        Size childSize = result.size();

        double width = constraints.hasBoundedWidth() && widthFactor == null
                ? constraints.maxWidth()
                : constraints.constrainWidth(childSize.width() * (widthFactor != null ? widthFactor : 1));
        double height = constraints.hasBoundedHeight() && heightFactor == null
                ? constraints.maxHeight()
                : constraints.constrainHeight(childSize.height() * (heightFactor != null ? heightFactor : 1));
        Size size = new Size(width, height);

        Point offset = alignment.resolve(size, childSize);
        placement.set(new ChildPlacement(child, childSize, offset));

        Double baseline = result.hasBaseline() ? result.baseline() + offset.y() : null;
        return LayoutResult.of(size, baseline);
    }

    @Override
    public void paint(PaintContext context) {
        if (child != null) {
            placement.get().paint(context);
        }
    }
}
