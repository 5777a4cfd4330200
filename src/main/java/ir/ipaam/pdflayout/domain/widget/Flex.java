package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Axis;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.SizingStrategy;
import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.Builder;
import lombok.Singular;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays children out in a line along its direction.
 * <p>
 * Inflexible children go first, each offered what is left of the main axis. The remaining space is then split
 * between {@link Flexible} children by flex factor. On an unbounded main axis flexible children are laid out as
 * inflexible ones. Horizontal flexes run right to left when the text direction is RTL.
 */
@SuperBuilder
public abstract class Flex extends BaseWidget {

    @Singular
    private final List<Widget> children;
    @Builder.Default
    private final MainAxisAlignment mainAxisAlignment = MainAxisAlignment.START;
    @Builder.Default
    private final CrossAxisAlignment crossAxisAlignment = CrossAxisAlignment.CENTER;
    @Builder.Default
    private final MainAxisSize mainAxisSize = MainAxisSize.MAX;
    private final double spacing;
    private final List<ChildPlacement> placements = new ArrayList<>();

    public abstract Axis getDirection();

    public List<Widget> getChildren() {
        return children;
    }

    @Override
    public LayoutResult layout(LayoutContext context) {
        Axis axis = getDirection();
        BoxConstraints constraints = context.constraints();
        double maxMain = constraints.maxAlong(axis);
        double maxCross = constraints.maxAlong(axis.flip());
        boolean boundedMain = constraints.hasBounded(axis);
        double minCross = crossAxisAlignment == CrossAxisAlignment.STRETCH && constraints.hasBounded(axis.flip())
                ? maxCross
                : 0;
        double totalSpacing = spacing * Math.max(0, children.size() - 1);

        LayoutResult[] results = new LayoutResult[children.size()];
        int totalFlex = 0;
        double allocated = 0;
        for (int i = 0; i < children.size(); i++) {
            Widget child = children.get(i);
            int flex = flexOf(child, boundedMain);
            if (flex > 0) {
                totalFlex += flex;
                continue;
            }
            double remaining = boundedMain ? Math.max(0, maxMain - allocated - totalSpacing) : Double.POSITIVE_INFINITY;
            results[i] = context.layoutChild(child, BoxConstraints.of(axis, 0, remaining, minCross, maxCross));
            allocated += results[i].size().along(axis);
        }

        if (totalFlex > 0) {
            double unit = Math.max(0, maxMain - allocated - totalSpacing) / totalFlex;
            for (int i = 0; i < children.size(); i++) {
                Widget child = children.get(i);
                int flex = flexOf(child, boundedMain);
                if (flex == 0) {
                    continue;
                }
                double share = unit * flex;
                double minMain = ((Flexible) child).getFit() == FlexFit.TIGHT ? share : 0;
                results[i] = context.layoutChild(child, BoxConstraints.of(axis, minMain, share, minCross, maxCross));
            }
        }

        List<LayoutResult> measured = new ArrayList<>(List.of(results));
        double childrenMain = measured.stream().mapToDouble(result -> result.size().along(axis)).sum();
        if (totalSpacing > 0) {
            measured.add(LayoutResult.of(Size.of(axis, totalSpacing, 0)));
        }
        Size wrapped = context.solver().negotiateSize(measured, constraints, SizingStrategy.WRAP, axis);
        Size size = mainAxisSize == MainAxisSize.MAX && boundedMain
                ? Size.of(axis, maxMain, wrapped.across(axis))
                : wrapped;

        position(results, size, childrenMain, totalSpacing, axis == Axis.HORIZONTAL && context.isRtl());

        Double baseline = null;
        for (int i = 0; i < results.length && baseline == null; i++) {
            if (results[i].hasBaseline()) {
                baseline = results[i].baseline() + placements.get(i).offset().y();
            }
        }
        return LayoutResult.of(size, baseline);
    }

    @Override
    public void paint(PaintContext context) {
        placements.forEach(placement -> placement.paint(context));
    }

    private void position(LayoutResult[] results, Size size, double childrenMain, double totalSpacing,
                          boolean reversed) {
        Axis axis = getDirection();
        int count = results.length;
        double mainSize = size.along(axis);
        double crossSize = size.across(axis);
        double free = Math.max(0, mainSize - childrenMain - totalSpacing);

        double leading = 0;
        double between = spacing;
        switch (mainAxisAlignment) {
            case END -> leading = free;
            case CENTER -> leading = free / 2;
            case SPACE_BETWEEN -> between += count > 1 ? free / (count - 1) : 0;
            case SPACE_AROUND -> {
                leading = free / count / 2;
                between += free / count;
            }
            case SPACE_EVENLY -> {
                leading = free / (count + 1);
                between += free / (count + 1);
            }
            default -> {
            }
        }

        placements.clear();
        double position = leading;
        for (int i = 0; i < count; i++) {
            Size childSize = results[i].size();
            double childMain = childSize.along(axis);
            double childCross = childSize.across(axis);
            double cross = switch (crossAxisAlignment) {
                case END -> crossSize - childCross;
                case CENTER -> (crossSize - childCross) / 2;
                default -> 0;
            };
            double main = reversed ? mainSize - position - childMain : position;
            Point offset = axis == Axis.HORIZONTAL ? new Point(main, cross) : new Point(cross, main);
            placements.add(new ChildPlacement(children.get(i), childSize, offset));
            position += childMain + between;
        }
    }

    private static int flexOf(Widget child, boolean boundedMain) {
        if (boundedMain && child instanceof Flexible flexible) {
            return Math.max(0, flexible.getFlex());
        }
        return 0;
    }
}
