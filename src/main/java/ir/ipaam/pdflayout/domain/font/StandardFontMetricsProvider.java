package ir.ipaam.pdflayout.domain.font;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics read from the AFM files PDFBox ships for the standard fonts.
 */
@Slf4j
public class StandardFontMetricsProvider implements FontMetricsProvider {

    private static final char REPLACEMENT = '?';

    private final Map<StandardFont, PDType1Font> fonts = new EnumMap<>(StandardFont.class);

    @Override
    public double textWidth(StandardFont font, double fontSize, String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        PDType1Font pdFont = load(font);
        double units = 0;
        for (int i = 0; i < text.length(); i++) {
            units += glyphWidth(pdFont, text.charAt(i));
        }
        return units / 1000 * fontSize;
    }

    @Override
    public FontMetrics metrics(StandardFont font, double fontSize) {
        PDFontDescriptor descriptor = load(font).getFontDescriptor();
        double ascent = descriptor != null ? descriptor.getAscent() : 718;
        double descent = descriptor != null ? descriptor.getDescent() : -207;
        if (ascent == 0 && descent == 0) {
            ascent = 800;
            descent = -200;
        }
        return new FontMetrics(ascent / 1000 * fontSize, descent / 1000 * fontSize, 0);
    }

    private double glyphWidth(PDType1Font font, char c) {
        try {
            return font.getStringWidth(String.valueOf(c));
        } catch (IllegalArgumentException e) {
            return replacementWidth(font);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to measure glyph in " + font.getName(), e);
        }
    }

    private double replacementWidth(PDType1Font font) {
        try {
            return font.getStringWidth(String.valueOf(REPLACEMENT));
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to measure replacement glyph in " + font.getName(), e);
        }
    }

    private synchronized PDType1Font load(StandardFont font) {
        return fonts.computeIfAbsent(font, key -> {
            log.debug("Loading standard font metrics for {}", key.getBaseFont());
            return new PDType1Font(key.getFontName());
        });
    }
}
