package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

/**
 * Places a child of a {@link Stack} by distances from the stack's edges. Outside a stack it is transparent.
 */
@Getter
@SuperBuilder
public class Positioned extends BaseWidget {

    private final Double left;
    private final Double top;
    private final Double right;
    private final Double bottom;
    private final Double width;
    private final Double height;
    private final Widget child;
    @Getter(lombok.AccessLevel.NONE)
    private final Committed<ChildPlacement> placement = new Committed<>();

    public static Positioned fill(Widget child) {
        return Positioned.builder().left(0.0).top(0.0).right(0.0).bottom(0.0).child(child).build();
    }

    /**
     * Constraints for the child inside a stack of {@code stackSize}: an axis is tight when both of its edges or an
     * explicit extent are given, otherwise loose up to the stack's extent.
     */
    BoxConstraints constraintsWithin(Size stackSize) {
        Double resolvedWidth = resolveExtent(left, right, width, stackSize.width());
        Double resolvedHeight = resolveExtent(top, bottom, height, stackSize.height());
        return new BoxConstraints(
                resolvedWidth != null ? resolvedWidth : 0,
                resolvedWidth != null ? resolvedWidth : stackSize.width(),
                resolvedHeight != null ? resolvedHeight : 0,
                resolvedHeight != null ? resolvedHeight : stackSize.height());
    }

    Point offsetWithin(Size stackSize, Size childSize) {
        double x = left != null ? left
                : right != null ? stackSize.width() - right - childSize.width()
                : 0;
        double y = top != null ? top
                : bottom != null ? stackSize.height() - bottom - childSize.height()
                : 0;
        return new Point(x, y);
    }

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

    private static Double resolveExtent(Double start, Double end, Double extent, double available) {
        if (extent != null) {
            return Math.max(0, extent);
        }
        if (start != null && end != null) {
            return Math.max(0, available - start - end);
        }
        return null;
    }
}
