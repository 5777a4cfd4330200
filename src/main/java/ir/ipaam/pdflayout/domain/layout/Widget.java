package ir.ipaam.pdflayout.domain.layout;

/**
 * A node of the layout tree. Layout and paint are separate passes: {@link #paint} draws exactly the size
 * committed by the last {@link #layout} call and never lays out again.
 */
public interface Widget {

    LayoutResult layout(LayoutContext context);

    void paint(PaintContext context);

    /**
     * Identity key, unique among siblings, used to address cached layout results.
     */
    default String getKey() {
        return null;
    }

    default String getDebugLabel() {
        return null;
    }
}
