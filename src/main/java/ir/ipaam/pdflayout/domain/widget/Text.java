package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.font.FontMetrics;
import ir.ipaam.pdflayout.domain.font.FontMetricsProvider;
import ir.ipaam.pdflayout.domain.font.StandardFont;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.graphics.GraphicsContext;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.pdf.PdfColor;
import ir.ipaam.pdflayout.domain.pdf.PdfFont;
import ir.ipaam.pdflayout.domain.theme.TextStyle;
import ir.ipaam.pdflayout.domain.util.BidiTextUtils;
import ir.ipaam.pdflayout.domain.util.TextWrapUtils;
import lombok.Builder;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Paragraph of text in one style, word-wrapped to the available width.
 */
@SuperBuilder
public class Text extends BaseWidget {

    private static final String ELLIPSIS = "...";

    private final String content;
    private final TextStyle style;
    @Builder.Default
    private final TextAlign textAlign = TextAlign.START;
    @Builder.Default
    private final TextOverflow overflow = TextOverflow.CLIP;
    private final Integer maxLines;
    @Builder.Default
    private final boolean softWrap = true;
    private final Committed<TextLayout> committed = new Committed<>();

    public static Text of(String content) {
        return Text.builder().content(content).build();
    }

    public static Text of(String content, TextStyle style) {
        return Text.builder().content(content).style(style).build();
    }

    @Override
    public LayoutResult layout(LayoutContext context) {
        TextStyle resolved = context.theme().defaultTextStyle().merge(style);
        StandardFont font = resolved.resolveFont();
        double fontSize = resolved.fontSizeOrDefault();
        FontMetricsProvider measurer = context.fontMetrics();
        FontMetrics metrics = measurer.metrics(font, fontSize);
        double lineHeight = fontSize * resolved.lineHeightOrDefault();
        double halfLeading = (lineHeight - metrics.height()) / 2;

        BoxConstraints constraints = context.constraints();
        List<String> logical = TextWrapUtils.breakLines(content != null ? content : "", constraints.maxWidth(),
                softWrap, measurer, font, fontSize);
        if (maxLines != null && maxLines > 0 && logical.size() > maxLines) {
            logical = truncate(logical, maxLines, constraints.maxWidth(), measurer, font, fontSize);
        }
        // lines below the height limit are dropped
        int fitting = TextWrapUtils.fittingLines(constraints.maxHeight(), lineHeight);
        if (logical.size() > fitting) {
            logical = fitting > 0
                    ? truncate(logical, fitting, constraints.maxWidth(), measurer, font, fontSize)
                    : List.of();
        }

        boolean rtl = context.isRtl();
        List<TextLine> lines = new ArrayList<>(logical.size());
        double width = 0;
        for (String line : logical) {
            double lineWidth = measurer.textWidth(font, fontSize, line);
            lines.add(new TextLine(BidiTextUtils.toVisualOrder(line, rtl), lineWidth));
            width = Math.max(width, lineWidth);
        }

        Size size = constraints.constrain(new Size(width, lines.size() * lineHeight));
        double ascent = halfLeading + metrics.ascent();
        committed.set(new TextLayout(lines, font, fontSize, lineHeight, ascent, metrics.descent(),
                resolved.color() != null ? resolved.color() : PdfColor.BLACK,
                Boolean.TRUE.equals(resolved.underline()), resolveAlign(rtl)));
        return LayoutResult.of(size, ascent);
    }

    @Override
    public void paint(PaintContext context) {
        TextLayout layout = committed.get();
        GraphicsContext graphics = context.graphics();
        PdfFont font = context.fonts().getFont(layout.font());
        double width = context.size().width();

        graphics.setFillColor(layout.color());
        for (int i = 0; i < layout.lines().size(); i++) {
            TextLine line = layout.lines().get(i);
            if (line.text().isEmpty()) {
                continue;
            }
            double x = switch (layout.align()) {
                case RIGHT -> width - line.width();
                case CENTER -> (width - line.width()) / 2;
                default -> 0;
            };
            double baseline = i * layout.lineHeight() + layout.ascent();
            graphics.drawString(font, layout.fontSize(), line.text(), x, baseline);

            if (layout.underline()) {
                double y = baseline - layout.descent() / 2;
                graphics.setStrokeColor(layout.color());
                graphics.setLineWidth(Math.max(0.5, layout.fontSize() / 18));
                graphics.drawLine(x, y, x + line.width(), y);
                graphics.strokePath();
            }
        }
    }

    private TextAlign resolveAlign(boolean rtl) {
        return switch (textAlign) {
            case START -> rtl ? TextAlign.RIGHT : TextAlign.LEFT;
            case END -> rtl ? TextAlign.LEFT : TextAlign.RIGHT;
            default -> textAlign;
        };
    }

    private List<String> truncate(List<String> lines, int count, double maxWidth, FontMetricsProvider measurer,
                                  StandardFont font, double fontSize) {
        List<String> kept = new ArrayList<>(lines.subList(0, count));
        if (overflow != TextOverflow.ELLIPSIS) {
            return kept;
        }
        String last = kept.get(kept.size() - 1);
        while (!last.isEmpty() && measurer.textWidth(font, fontSize, last + ELLIPSIS) > maxWidth) {
            last = last.substring(0, last.length() - 1);
        }
        kept.set(kept.size() - 1, last.stripTrailing() + ELLIPSIS);
        return kept;
    }

    private record TextLine(String text, double width) {
    }

    private record TextLayout(List<TextLine> lines, StandardFont font, double fontSize, double lineHeight,
                              double ascent, double descent, PdfColor color, boolean underline,
                              TextAlign align) {
    }
}
