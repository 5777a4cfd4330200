package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.TextDirection;
import ir.ipaam.pdflayout.domain.layout.Widget;
import ir.ipaam.pdflayout.domain.theme.ThemeData;
import lombok.Builder;
import lombok.Getter;

import java.util.function.Supplier;

/**
 * Page creation request: a named format or an explicit width and height, margins, and an optional builder for the
 * root widget.
 */
@Getter
@Builder
public class PageOptions {

    public static final double DEFAULT_MARGIN = 20;

    private final PageFormat format;
    private final Double width;
    private final Double height;
    private final boolean landscape;
    @Builder.Default
    private final EdgeInsets margins = EdgeInsets.all(DEFAULT_MARGIN);
    @Builder.Default
    private final TextDirection textDirection = TextDirection.LTR;
    private final ThemeData theme;
    private final Supplier<Widget> build;

    Size resolveSize() {
        Size size;
        if (width != null || height != null) {
            if (width == null || height == null) {
                throw new IllegalArgumentException("Explicit page size needs both width and height");
            }
            size = new Size(width, height);
        } else {
            PageFormat resolved = format != null ? format : PageFormat.LETTER;
            size = resolved.getSize();
        }
        return landscape && size.height() > size.width() ? new Size(size.height(), size.width()) : size;
    }
}
