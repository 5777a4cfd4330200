package ir.ipaam.pdflayout.domain.pdf;

import java.util.Locale;

/**
 * RGB color with channels clamped to {@code [0, 1]}. Equality is exact on the normalized channels.
 */
public record PdfColor(double red, double green, double blue) {

    public static final PdfColor BLACK = new PdfColor(0, 0, 0);
    public static final PdfColor WHITE = new PdfColor(1, 1, 1);
    public static final PdfColor RED = new PdfColor(1, 0, 0);
    public static final PdfColor GREEN = new PdfColor(0, 1, 0);
    public static final PdfColor BLUE = new PdfColor(0, 0, 1);
    public static final PdfColor GREY = new PdfColor(0.5, 0.5, 0.5);
    public static final PdfColor LIGHT_GREY = new PdfColor(0.827, 0.827, 0.827);

    public PdfColor {
        red = clamp(red);
        green = clamp(green);
        blue = clamp(blue);
    }

    public static PdfColor fromRgb255(int red, int green, int blue) {
        return new PdfColor(red / 255.0, green / 255.0, blue / 255.0);
    }

    public static PdfColor fromInt(int rgb) {
        return fromRgb255((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    /**
     * Parses {@code #RGB}, {@code #RRGGBB} or {@code #AARRGGBB} (alpha ignored), with or without the leading hash.
     */
    public static PdfColor fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Color value is required");
        }
        String value = hex.startsWith("#") ? hex.substring(1) : hex;
        if (value.length() == 3) {
            value = new StringBuilder()
                    .append(value.charAt(0)).append(value.charAt(0))
                    .append(value.charAt(1)).append(value.charAt(1))
                    .append(value.charAt(2)).append(value.charAt(2))
                    .toString();
        } else if (value.length() == 8) {
            value = value.substring(2);
        }
        if (value.length() != 6) {
            throw new IllegalArgumentException("Malformed color '" + hex + "'");
        }
        try {
            return fromInt(Integer.parseInt(value, 16));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed color '" + hex + "'", e);
        }
    }

    public int toInt() {
        return (channel(red) << 16) | (channel(green) << 8) | channel(blue);
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%06x", toInt());
    }

    public double luminance() {
        return 0.2126 * linear(red) + 0.7152 * linear(green) + 0.0722 * linear(blue);
    }

    public boolean isLight() {
        return luminance() > 0.179;
    }

    private static int channel(double value) {
        return (int) Math.round(value * 255);
    }

    private static double linear(double channel) {
        return channel <= 0.03928 ? channel / 12.92 : Math.pow((channel + 0.055) / 1.055, 2.4);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
