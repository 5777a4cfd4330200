package ir.ipaam.pdflayout.domain.font;

/**
 * Vertical metrics of a font scaled to a font size, in points. {@code descent} is negative below the baseline.
 */
public record FontMetrics(double ascent, double descent, double lineGap) {

    public double height() {
        return ascent - descent;
    }

    public double lineHeight() {
        return height() + lineGap;
    }
}
