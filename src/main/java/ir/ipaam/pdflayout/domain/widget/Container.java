package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Alignment;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Rect;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.graphics.GraphicsContext;
import ir.ipaam.pdflayout.domain.layout.ChildRequirements;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.Widget;
import lombok.Builder;
import lombok.experimental.SuperBuilder;

/**
 * Convenience box combining margin, decoration, size overrides, padding and child alignment.
 * <p>
 * The box shrink-wraps its padded child within its size constraints; explicit width or height make that axis tight.
 */
@SuperBuilder
public class Container extends BaseWidget {

    private final Widget child;
    @Builder.Default
    private final EdgeInsets padding = EdgeInsets.ZERO;
    @Builder.Default
    private final EdgeInsets margin = EdgeInsets.ZERO;
    private final Double width;
    private final Double height;
    private final Double minWidth;
    private final Double maxWidth;
    private final Double minHeight;
    private final Double maxHeight;
    @Builder.Default
    private final Alignment alignment = Alignment.CENTER;
    private final BoxDecoration decoration;
    private final Committed<ChildPlacement> placement = new Committed<>();

    @Override
    public LayoutResult layout(LayoutContext context) {
        BoxConstraints constraints = context.constraints();
        BoxConstraints available = margin.deflateConstraints(constraints);
        BoxConstraints box = context.solver().propagateConstraints(available, ChildRequirements.builder()
                .width(width)
                .height(height)
                .minWidth(minWidth)
                .maxWidth(maxWidth)
                .minHeight(minHeight)
                .maxHeight(maxHeight)
                .build());
        if (width != null) {
            box = new BoxConstraints(box.maxWidth(), box.maxWidth(), box.minHeight(), box.maxHeight());
        }
        if (height != null) {
            box = new BoxConstraints(box.minWidth(), box.maxWidth(), box.maxHeight(), box.maxHeight());
        }

        Size boxSize;
        Double baseline = null;
        if (child == null) {
            boxSize = box.constrain(padding.inflateSize(Size.ZERO));
        } else {
            BoxConstraints inner = padding.deflateConstraints(box).loosen();
            LayoutResult result = context.layoutChild(child, inner);
            boxSize = box.constrain(padding.inflateSize(result.size()));

            Point aligned = alignment.resolve(padding.deflateSize(boxSize), result.size());
            Point offset = margin.topLeft().plus(padding.topLeft()).plus(aligned);
            placement.set(new ChildPlacement(child, result.size(), offset));
            if (result.hasBaseline()) {
                baseline = result.baseline() + offset.y();
            }
        }

        return LayoutResult.of(constraints.constrain(margin.inflateSize(boxSize)), baseline);
    }

    @Override
    public void paint(PaintContext context) {
        Size boxSize = margin.deflateSize(context.size());
        Rect rect = new Rect(margin.left(), margin.top(), boxSize.width(), boxSize.height());
        GraphicsContext graphics = context.graphics();

        if (decoration != null) {
            graphics.saveContext();
            decoration.paintBackground(graphics, rect);
            graphics.restoreContext();
        }

        if (child != null) {
            placement.get().paint(context);
        }

        if (decoration != null) {
            graphics.saveContext();
            decoration.paintBorder(graphics, rect);
            graphics.restoreContext();
        }
    }
}
