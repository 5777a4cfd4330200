package ir.ipaam.pdflayout.domain.font;

import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.util.Locale;

/**
 * The fourteen standard PDF fonts every conforming reader supplies without embedding.
 */
public enum StandardFont {
    HELVETICA(Standard14Fonts.FontName.HELVETICA, "helvetica", false, false),
    HELVETICA_BOLD(Standard14Fonts.FontName.HELVETICA_BOLD, "helvetica", true, false),
    HELVETICA_OBLIQUE(Standard14Fonts.FontName.HELVETICA_OBLIQUE, "helvetica", false, true),
    HELVETICA_BOLD_OBLIQUE(Standard14Fonts.FontName.HELVETICA_BOLD_OBLIQUE, "helvetica", true, true),
    TIMES_ROMAN(Standard14Fonts.FontName.TIMES_ROMAN, "times", false, false),
    TIMES_BOLD(Standard14Fonts.FontName.TIMES_BOLD, "times", true, false),
    TIMES_ITALIC(Standard14Fonts.FontName.TIMES_ITALIC, "times", false, true),
    TIMES_BOLD_ITALIC(Standard14Fonts.FontName.TIMES_BOLD_ITALIC, "times", true, true),
    COURIER(Standard14Fonts.FontName.COURIER, "courier", false, false),
    COURIER_BOLD(Standard14Fonts.FontName.COURIER_BOLD, "courier", true, false),
    COURIER_OBLIQUE(Standard14Fonts.FontName.COURIER_OBLIQUE, "courier", false, true),
    COURIER_BOLD_OBLIQUE(Standard14Fonts.FontName.COURIER_BOLD_OBLIQUE, "courier", true, true),
    SYMBOL(Standard14Fonts.FontName.SYMBOL, "symbol", false, false),
    ZAPF_DINGBATS(Standard14Fonts.FontName.ZAPF_DINGBATS, "zapfdingbats", false, false);

    private final Standard14Fonts.FontName fontName;
    private final String family;
    private final boolean bold;
    private final boolean italic;

    StandardFont(Standard14Fonts.FontName fontName, String family, boolean bold, boolean italic) {
        this.fontName = fontName;
        this.family = family;
        this.bold = bold;
        this.italic = italic;
    }

    public Standard14Fonts.FontName getFontName() {
        return fontName;
    }

    /**
     * PostScript name written as {@code /BaseFont}, e.g. {@code Times-Roman}.
     */
    public String getBaseFont() {
        return fontName.getName();
    }

    public boolean isSymbolic() {
        return this == SYMBOL || this == ZAPF_DINGBATS;
    }

    /**
     * Picks the standard font for a family name and style. Unknown families fall back to Helvetica.
     */
    public static StandardFont resolve(String family, boolean bold, boolean italic) {
        String normalized = normalizeFamily(family);
        for (StandardFont font : values()) {
            if (font.family.equals(normalized) && (font.isSymbolic() || (font.bold == bold && font.italic == italic))) {
                return font;
            }
        }
        return resolve("helvetica", bold, italic);
    }

    private static String normalizeFamily(String family) {
        if (family == null) {
            return "helvetica";
        }
        String key = family.toLowerCase(Locale.ROOT).replace(" ", "").replace("-", "");
        return switch (key) {
            case "times", "timesroman", "timesnewroman", "serif" -> "times";
            case "courier", "couriernew", "monospace" -> "courier";
            case "symbol" -> "symbol";
            case "zapfdingbats", "dingbats" -> "zapfdingbats";
            default -> "helvetica";
        };
    }
}
