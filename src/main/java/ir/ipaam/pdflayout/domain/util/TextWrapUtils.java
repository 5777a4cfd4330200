package ir.ipaam.pdflayout.domain.util;

import ir.ipaam.pdflayout.domain.font.FontMetricsProvider;
import ir.ipaam.pdflayout.domain.font.StandardFont;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrapping against measured glyph widths.
 */
public final class TextWrapUtils {

    private TextWrapUtils() {
    }

    /**
     * Splits {@code text} on explicit line breaks and, when {@code softWrap} is set and the width is bounded, wraps
     * each of them at word boundaries. Words wider than a line are broken between characters.
     */
    public static List<String> breakLines(String text, double maxWidth, boolean softWrap,
                                          FontMetricsProvider measurer, StandardFont font, double fontSize) {
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\\R", -1)) {
            if (!softWrap || !Double.isFinite(maxWidth)) {
                lines.add(paragraph.strip());
                continue;
            }
            StringBuilder current = new StringBuilder();
            for (String word : paragraph.trim().split("\\s+")) {
                if (word.isEmpty()) {
                    continue;
                }
                String candidate = current.length() == 0 ? word : current + " " + word;
                if (measurer.textWidth(font, fontSize, candidate) <= maxWidth) {
                    current.setLength(0);
                    current.append(candidate);
                    continue;
                }
                if (current.length() > 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                }
                if (measurer.textWidth(font, fontSize, word) <= maxWidth) {
                    current.append(word);
                } else {
                    current.append(splitLongWord(word, maxWidth, measurer, font, fontSize, lines));
                }
            }
            lines.add(current.toString());
        }
        return lines;
    }

    /**
     * Number of whole lines of the given height that fit in {@code available}.
     */
    public static int fittingLines(double available, double lineHeight) {
        if (!Double.isFinite(available)) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.floor((available + 1e-6) / lineHeight);
    }

    /**
     * Breaks a word wider than the line into chunks, adding all full chunks to {@code lines} and returning the rest.
     */
    private static String splitLongWord(String word, double maxWidth, FontMetricsProvider measurer,
                                        StandardFont font, double fontSize, List<String> lines) {
        StringBuilder chunk = new StringBuilder();
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (chunk.length() > 0 && measurer.textWidth(font, fontSize, chunk.toString() + c) > maxWidth) {
                lines.add(chunk.toString());
                chunk.setLength(0);
            }
            chunk.append(c);
        }
        return chunk.toString();
    }
}
