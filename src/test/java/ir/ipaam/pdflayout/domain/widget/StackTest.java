package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Alignment;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.LayoutResult;
import ir.ipaam.pdflayout.domain.layout.TestLayouts;
import ir.ipaam.pdflayout.domain.layout.TestLayouts.FixedBox;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StackTest {

    private static final BoxConstraints SPACE = BoxConstraints.loose(new Size(300, 200));

    @Test
    void sizesToLargestNonPositionedChild() {
        FixedBox background = new FixedBox("background", 100, 50);
        FixedBox badge = new FixedBox("badge", 20, 20);

        LayoutResult result = TestLayouts.layoutAndPaint(Stack.builder()
                .child(background)
                .child(Positioned.builder().left(10.0).top(5.0).child(badge).build())
                .build(), SPACE);

        assertThat(result.size()).isEqualTo(new Size(100, 50));
        assertThat(background.getPaintOrigin()).isEqualTo(Point.ZERO);
        assertThat(badge.getPaintOrigin()).isEqualTo(new Point(10, 5));
    }

    @Test
    void rightAndBottomAnchorFromFarEdges() {
        FixedBox badge = new FixedBox("badge", 20, 20);

        TestLayouts.layoutAndPaint(Stack.builder()
                .child(new FixedBox("background", 100, 50))
                .child(Positioned.builder().right(10.0).bottom(10.0).child(badge).build())
                .build(), SPACE);

        assertThat(badge.getPaintOrigin()).isEqualTo(new Point(70, 20));
    }

    @Test
    void fillStretchesToStack() {
        FixedBox overlay = new FixedBox("overlay", 1, 1);

        TestLayouts.layoutAndPaint(Stack.builder()
                .child(new FixedBox("background", 100, 50))
                .child(Positioned.fill(overlay))
                .build(), SPACE);

        assertThat(overlay.getPaintSize()).isEqualTo(new Size(100, 50));
    }

    @Test
    void alignmentPlacesSmallerChildren() {
        FixedBox small = new FixedBox("small", 20, 10);

        TestLayouts.layoutAndPaint(Stack.builder()
                .child(new FixedBox("big", 100, 50))
                .child(small)
                .alignment(Alignment.CENTER)
                .build(), SPACE);

        assertThat(small.getPaintOrigin()).isEqualTo(new Point(40, 20));
    }

    @Test
    void expandFitFillsConstraints() {
        FixedBox child = new FixedBox("child", 10, 10);

        LayoutResult result = TestLayouts.layoutAndPaint(Stack.builder()
                .child(child)
                .fit(StackFit.EXPAND)
                .build(), SPACE);

        assertThat(result.size()).isEqualTo(new Size(300, 200));
        assertThat(child.getPaintSize()).isEqualTo(new Size(300, 200));
    }

    @Test
    void onlyPositionedChildrenTakeBiggestSize() {
        LayoutResult result = TestLayouts.layoutAndPaint(Stack.builder()
                .child(Positioned.builder().left(0.0).top(0.0).child(new FixedBox("p", 5, 5)).build())
                .build(), SPACE);

        assertThat(result.size()).isEqualTo(new Size(300, 200));
    }
}
