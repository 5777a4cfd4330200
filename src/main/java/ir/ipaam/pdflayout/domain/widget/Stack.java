package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Alignment;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.graphics.GraphicsContext;
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
 * Overlays its children. Non-positioned children size the stack and are aligned inside it; {@link Positioned}
 * children are placed against the resulting size. Later children paint on top.
 */
@SuperBuilder
public class Stack extends BaseWidget {

    @Singular
    private final List<Widget> children;
    @Builder.Default
    private final Alignment alignment = Alignment.TOP_LEFT;
    @Builder.Default
    private final StackFit fit = StackFit.LOOSE;
    private final boolean clip;
    private final List<ChildPlacement> placements = new ArrayList<>();

    @Override
    public LayoutResult layout(LayoutContext context) {
        BoxConstraints constraints = context.constraints();
        BoxConstraints childConstraints = switch (fit) {
            case LOOSE -> constraints.loosen();
            case EXPAND -> new BoxConstraints(
                    constraints.hasBoundedWidth() ? constraints.maxWidth() : constraints.minWidth(),
                    constraints.maxWidth(),
                    constraints.hasBoundedHeight() ? constraints.maxHeight() : constraints.minHeight(),
                    constraints.maxHeight());
            case PASSTHROUGH -> constraints;
        };

        LayoutResult[] results = new LayoutResult[children.size()];
        List<LayoutResult> sizing = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            if (!(children.get(i) instanceof Positioned)) {
                results[i] = context.layoutChild(children.get(i), childConstraints);
                sizing.add(results[i]);
            }
        }

        Size size;
        if (sizing.isEmpty()) {
            size = new Size(
                    constraints.hasBoundedWidth() ? constraints.maxWidth() : constraints.minWidth(),
                    constraints.hasBoundedHeight() ? constraints.maxHeight() : constraints.minHeight());
        } else {
            Size fitted = constraints.constrain(context.solver().negotiateSize(sizing, constraints, SizingStrategy.FIT));
            if (fit == StackFit.EXPAND) {
                // unbounded axes keep the fitted extent
                Size expanded = context.solver().negotiateSize(sizing, constraints, SizingStrategy.EXPAND);
                size = new Size(
                        constraints.hasBoundedWidth() ? expanded.width() : fitted.width(),
                        constraints.hasBoundedHeight() ? expanded.height() : fitted.height());
            } else {
                size = fitted;
            }
        }

        placements.clear();
        Double baseline = null;
        for (int i = 0; i < children.size(); i++) {
            Widget child = children.get(i);
            Point offset;
            if (child instanceof Positioned positioned) {
                results[i] = context.layoutChild(positioned, positioned.constraintsWithin(size));
                offset = positioned.offsetWithin(size, results[i].size());
            } else {
                offset = alignment.resolve(size, results[i].size());
                if (baseline == null && results[i].hasBaseline()) {
                    baseline = results[i].baseline() + offset.y();
                }
            }
            placements.add(new ChildPlacement(child, results[i].size(), offset));
        }
        return LayoutResult.of(size, baseline);
    }

    @Override
    public void paint(PaintContext context) {
        GraphicsContext graphics = context.graphics();
        if (clip) {
            graphics.saveContext();
            graphics.drawRect(0, 0, context.size().width(), context.size().height());
            graphics.clipPath();
        }
        placements.forEach(placement -> placement.paint(context));
        if (clip) {
            graphics.restoreContext();
        }
    }
}
