package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.Builder;
import lombok.experimental.SuperBuilder;

@SuperBuilder
public class Padding extends BaseWidget {

    @Builder.Default
    private final EdgeInsets padding = EdgeInsets.ZERO;
    private final Widget child;
    private final Committed<ChildPlacement> placement = new Committed<>();

    public static Padding of(EdgeInsets padding, Widget child) {
        return Padding.builder().padding(padding).child(child).build();
    }

    @Override
    public LayoutResult layout(LayoutContext context) {
        BoxConstraints constraints = context.constraints();
        if (child == null) {
            return LayoutResult.of(constraints.constrain(padding.inflateSize(Size.ZERO)));
        }

        LayoutResult result = context.layoutChild(child, padding.deflateConstraints(constraints));
        placement.set(new ChildPlacement(child, result.size(), padding.topLeft()));

        Size size = constraints.constrain(padding.inflateSize(result.size()));
        Double baseline = result.hasBaseline() ? result.baseline() + padding.top() : null;
        return LayoutResult.of(size, baseline);
    }

    @Override
    public void paint(PaintContext context) {
        if (child != null) {
            placement.get().paint(context);
        }
    }
}
