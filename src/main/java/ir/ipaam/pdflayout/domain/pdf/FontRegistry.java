package ir.ipaam.pdflayout.domain.pdf;

import ir.ipaam.pdflayout.domain.font.StandardFont;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-document font resources, registered lazily and named {@code /F1}, {@code /F2}, ... in registration order.
 */
public class FontRegistry {

    private final PdfDocument document;
    private final Map<StandardFont, PdfFont> fonts = new EnumMap<>(StandardFont.class);
    private int counter;

    FontRegistry(PdfDocument document) {
        this.document = document;
    }

    public PdfFont getFont(StandardFont font) {
        return fonts.computeIfAbsent(font, key -> new PdfFont(document, key, "/F" + (++counter)));
    }

    public PdfFont getFont(String family, boolean bold, boolean italic) {
        return getFont(StandardFont.resolve(family, bold, italic));
    }

    public PdfFont getDefaultFont() {
        return getFont(StandardFont.HELVETICA);
    }

    public boolean contains(PdfFont font) {
        return fonts.get(font.getFont()) == font;
    }

    public Collection<PdfFont> getRegisteredFonts() {
        return Collections.unmodifiableCollection(fonts.values());
    }
}
