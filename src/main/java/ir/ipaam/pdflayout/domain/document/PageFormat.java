package ir.ipaam.pdflayout.domain.document;

import ir.ipaam.pdflayout.domain.geometry.Size;

import java.util.Locale;

/**
 * Named page sizes in points, portrait.
 */
public enum PageFormat {
    A3(842, 1191),
    A4(595, 842),
    A5(420, 595),
    LETTER(612, 792),
    LEGAL(612, 1008);

    private final double width;
    private final double height;

    PageFormat(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public Size getSize() {
        return new Size(width, height);
    }

    public Size getLandscapeSize() {
        return new Size(height, width);
    }

    public static PageFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Page format name is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown page format '" + name + "'", e);
        }
    }
}
