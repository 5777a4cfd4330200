package ir.ipaam.pdflayout.domain.font;

/**
 * Measures text for layout. Implementations must answer identically for identical inputs,
 * since layout results are cached.
 */
public interface FontMetricsProvider {

    double textWidth(StandardFont font, double fontSize, String text);

    FontMetrics metrics(StandardFont font, double fontSize);

    default double charWidth(StandardFont font, double fontSize, char c) {
        return textWidth(font, fontSize, String.valueOf(c));
    }
}
