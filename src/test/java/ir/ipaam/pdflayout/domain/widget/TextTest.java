package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.font.StandardFont;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.LayoutContext;
import ir.ipaam.pdflayout.domain.layout.LayoutOptions;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.TestLayouts;
import ir.ipaam.pdflayout.domain.layout.Widget;
import ir.ipaam.pdflayout.domain.theme.TextStyle;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextTest {

    private static final double LINE = 12 * 1.2;

    @Test
    void singleLineUsesMeasuredWidth() {
        LayoutResult result = layout(Text.of("Hello world"), BoxConstraints.loose(new Size(1000, 100)));

        assertThat(result.size().width()).isCloseTo(width("Hello world"), within(1e-9));
        assertThat(result.size().height()).isCloseTo(LINE, within(1e-9));
        assertThat(result.baseline()).isBetween(0.0, LINE);
    }

    @Test
    void wrapsAtWordBoundaries() {
        LayoutResult result = layout(Text.of("Hello world"), BoxConstraints.loose(new Size(40, 100)));

        assertThat(result.size().height()).isCloseTo(2 * LINE, within(1e-9));
        assertThat(result.size().width()).isCloseTo(width("world"), within(1e-9));
    }

    @Test
    void longWordIsSplitAcrossLines() {
        LayoutResult result = layout(Text.of("Supercalifragilistic"), BoxConstraints.loose(new Size(30, 500)));

        assertThat(result.size().width()).isLessThanOrEqualTo(30);
        assertThat(result.size().height()).isGreaterThan(2 * LINE);
    }

    @Test
    void maxLinesTruncates() {
        Text text = Text.builder()
                .content("one two three four five six seven eight")
                .maxLines(1)
                .overflow(TextOverflow.ELLIPSIS)
                .build();

        LayoutResult result = layout(text, BoxConstraints.loose(new Size(60, 500)));

        assertThat(result.size().height()).isCloseTo(LINE, within(1e-9));
    }

    @Test
    void noSoftWrapKeepsExplicitLinesOnly() {
        Text text = Text.builder().content("first line\nsecond line").softWrap(false).build();

        LayoutResult result = layout(text, BoxConstraints.loose(new Size(20, 500)));

        assertThat(result.size().height()).isCloseTo(2 * LINE, within(1e-9));
        assertThat(result.size().width()).isEqualTo(20);
    }

    @Test
    void styleOverridesFontSize() {
        Text text = Text.of("Hi", TextStyle.builder().fontSize(24.0).lineHeight(1.0).build());

        LayoutResult result = layout(text, BoxConstraints.loose(new Size(500, 500)));

        assertThat(result.size().height()).isCloseTo(24, within(1e-9));
    }

    @Test
    void paintedTextIsExtractable() throws IOException {
        Text text = Text.of("Layout engine");
        LayoutResult result = layout(text, BoxConstraints.loose(new Size(500, 100)));

        byte[] pdf = TestLayouts.paint(text, result.size()).save();

        try (PDDocument parsed = Loader.loadPDF(pdf)) {
            assertThat(new PDFTextStripper().getText(parsed)).contains("Layout engine");
        }
    }

    @Test
    void linesBeyondMaxHeightAreNotPainted() {
        Text text = Text.of("one two three four five six seven eight");
        BoxConstraints constraints = BoxConstraints.tight(new Size(60, 1.5 * LINE));

        LayoutResult result = layout(text, constraints);
        String content = contentOf(TestLayouts.paint(text, result.size()).save());

        assertThat(result.size()).isEqualTo(new Size(60, 1.5 * LINE));
        assertThat(countTj(content)).isEqualTo(1);
    }

    @Test
    void heightLimitAppliesEllipsisToLastVisibleLine() throws IOException {
        Text text = Text.builder()
                .content("one two three four five six seven eight")
                .overflow(TextOverflow.ELLIPSIS)
                .build();

        LayoutResult result = layout(text, BoxConstraints.loose(new Size(60, 2 * LINE)));
        byte[] pdf = TestLayouts.paint(text, result.size()).save();

        assertThat(result.size().height()).isCloseTo(2 * LINE, within(1e-9));
        assertThat(countTj(contentOf(pdf))).isEqualTo(2);
        try (PDDocument parsed = Loader.loadPDF(pdf)) {
            assertThat(new PDFTextStripper().getText(parsed)).contains("...").doesNotContain("eight");
        }
    }

    @Test
    void overfullColumnDoesNotPaintSqueezedText() {
        Column column = Column.builder()
                .children(List.of(Text.of("first"), Text.of("second")))
                .crossAxisAlignment(CrossAxisAlignment.START)
                .build();

        LayoutResult result = layout(column, BoxConstraints.loose(new Size(200, LINE)));
        String content = contentOf(TestLayouts.paint(column, result.size()).save());

        assertThat(countTj(content)).isEqualTo(1);
        assertThat(content).contains("(first) Tj").doesNotContain("(second) Tj");
    }

    private static LayoutResult layout(Widget widget, BoxConstraints constraints) {
        LayoutContext context = TestLayouts.context(constraints);
        return context.solver().solveLayout(widget, context, LayoutOptions.UNCACHED);
    }

    private static String contentOf(byte[] pdf) {
        return new String(pdf, StandardCharsets.ISO_8859_1);
    }

    private static int countTj(String content) {
        return content.split("\\) Tj", -1).length - 1;
    }

    private static double width(String value) {
        return TestLayouts.METRICS.textWidth(StandardFont.HELVETICA, 12, value);
    }
}
