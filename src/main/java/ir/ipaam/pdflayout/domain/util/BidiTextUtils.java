package ir.ipaam.pdflayout.domain.util;

import com.ibm.icu.text.Bidi;

import java.util.regex.Pattern;

public final class BidiTextUtils {

    private static final Pattern RTL_CHARS = Pattern.compile("[\\u0590-\\u08FF\\uFB1D-\\uFDFF\\uFE70-\\uFEFF]");

    private BidiTextUtils() {
    }

    public static boolean containsRtl(String text) {
        return text != null && RTL_CHARS.matcher(text).find();
    }

    /**
     * Reorders a logical line into visual order for a paragraph of the given base direction, mirroring
     * brackets inside right-to-left runs.
     */
    public static String toVisualOrder(String line, boolean rtlParagraph) {
        if (line == null || line.isEmpty()) {
            return line;
        }
        if (!rtlParagraph && !containsRtl(line)) {
            return line;
        }
        Bidi bidi = new Bidi();
        bidi.setPara(line, rtlParagraph ? Bidi.RTL : Bidi.LTR, null);
        return bidi.writeReordered(Bidi.DO_MIRRORING);
    }
}
