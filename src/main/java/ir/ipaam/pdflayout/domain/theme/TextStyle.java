package ir.ipaam.pdflayout.domain.theme;

import ir.ipaam.pdflayout.domain.font.StandardFont;
import ir.ipaam.pdflayout.domain.pdf.PdfColor;
import lombok.Builder;

/**
 * Text appearance. Unset fields ({@code null}) inherit from the style this one is merged onto.
 */
@Builder(toBuilder = true)
public record TextStyle(
        String fontFamily,
        Double fontSize,
        Boolean bold,
        Boolean italic,
        PdfColor color,
        Double lineHeight,
        Boolean underline) {

    public static final double DEFAULT_LINE_HEIGHT = 1.2;

    public static TextStyle defaults() {
        return new TextStyle("Helvetica", 12.0, false, false, PdfColor.BLACK, DEFAULT_LINE_HEIGHT, false);
    }

    public TextStyle merge(TextStyle override) {
        if (override == null) {
            return this;
        }
        return new TextStyle(
                override.fontFamily != null ? override.fontFamily : fontFamily,
                override.fontSize != null ? override.fontSize : fontSize,
                override.bold != null ? override.bold : bold,
                override.italic != null ? override.italic : italic,
                override.color != null ? override.color : color,
                override.lineHeight != null ? override.lineHeight : lineHeight,
                override.underline != null ? override.underline : underline);
    }

    public StandardFont resolveFont() {
        return StandardFont.resolve(fontFamily, Boolean.TRUE.equals(bold), Boolean.TRUE.equals(italic));
    }

    public double fontSizeOrDefault() {
        return fontSize != null ? fontSize : 12.0;
    }

    public double lineHeightOrDefault() {
        return lineHeight != null ? lineHeight : DEFAULT_LINE_HEIGHT;
    }
}
