package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Alignment;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.TestLayouts;
import ir.ipaam.pdflayout.domain.layout.TestLayouts.FixedBox;
import ir.ipaam.pdflayout.domain.pdf.PdfColor;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ContainerTest {

    private static final BoxConstraints SPACE = BoxConstraints.loose(new Size(300, 300));

    @Test
    void fixedSizeWithPaddingCentersChild() {
        FixedBox child = new FixedBox("child", 20, 20);

        LayoutResult result = TestLayouts.layoutAndPaint(Container.builder()
                .width(100.0)
                .height(50.0)
                .padding(EdgeInsets.all(10))
                .child(child)
                .build(), SPACE);

        assertThat(result.size()).isEqualTo(new Size(100, 50));
        assertThat(child.getPaintOrigin()).isEqualTo(new Point(40, 15));
    }

    @Test
    void shrinkWrapsChildPlusMargin() {
        FixedBox child = new FixedBox("child", 20, 20);

        LayoutResult result = TestLayouts.layoutAndPaint(Container.builder()
                .margin(EdgeInsets.all(5))
                .child(child)
                .build(), SPACE);

        assertThat(result.size()).isEqualTo(new Size(30, 30));
        assertThat(child.getPaintOrigin()).isEqualTo(new Point(5, 5));
    }

    @Test
    void alignmentAppliesInsideFixedBox() {
        FixedBox child = new FixedBox("child", 20, 20);

        TestLayouts.layoutAndPaint(Container.builder()
                .width(100.0)
                .height(100.0)
                .alignment(Alignment.BOTTOM_RIGHT)
                .child(child)
                .build(), SPACE);

        assertThat(child.getPaintOrigin()).isEqualTo(new Point(80, 80));
    }

    @Test
    void oversizedRequestIsClampedToParent() {
        LayoutResult result = TestLayouts.layoutAndPaint(Container.builder()
                .width(1000.0)
                .height(10.0)
                .build(), SPACE);

        assertThat(result.size()).isEqualTo(new Size(300, 10));
    }

    @Test
    void decorationPaintsFillAndBorder() {
        Container container = Container.builder()
                .width(100.0)
                .height(40.0)
                .decoration(BoxDecoration.builder()
                        .color(PdfColor.RED)
                        .border(new BorderSide(PdfColor.BLACK, 2))
                        .build())
                .build();
        LayoutResult result = TestLayouts.layoutAndPaint(container, SPACE);

        String pdf = new String(TestLayouts.paint(container, result.size()).save(), StandardCharsets.ISO_8859_1);

        assertThat(pdf).contains("1 0 0 rg\n0 960 100 40 re\nf\n");
        assertThat(pdf).contains("0 0 0 RG\n2 w\n1 961 98 38 re\nS\n");
    }
}
