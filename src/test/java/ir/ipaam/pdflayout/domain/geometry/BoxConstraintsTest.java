package ir.ipaam.pdflayout.domain.geometry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoxConstraintsTest {

    @Test
    void tightConstraintsAcceptOnlyTheirSize() {
        BoxConstraints tight = BoxConstraints.tight(new Size(100, 50));

        assertTrue(tight.isTight());
        assertTrue(tight.satisfies(new Size(100, 50)));
        assertFalse(tight.satisfies(new Size(99, 50)));
        assertThat(tight.biggest()).isEqualTo(tight.smallest());
    }

    @Test
    void looseConstraintsStartAtZero() {
        BoxConstraints loose = BoxConstraints.loose(new Size(200, 300));

        assertThat(loose.smallest()).isEqualTo(Size.ZERO);
        assertThat(loose.biggest()).isEqualTo(new Size(200, 300));
        assertTrue(loose.satisfies(new Size(0, 300)));
    }

    @Test
    void constrainClampsEachAxis() {
        BoxConstraints constraints = new BoxConstraints(10, 100, 20, 40);

        assertThat(constraints.constrain(new Size(5, 500))).isEqualTo(new Size(10, 40));
        assertThat(constraints.constrain(new Size(50, 30))).isEqualTo(new Size(50, 30));
    }

    @Test
    void isValidRejectsBrokenBounds() {
        assertTrue(BoxConstraints.UNBOUNDED.isValid());
        assertFalse(new BoxConstraints(-1, 10, 0, 10).isValid());
        assertFalse(new BoxConstraints(20, 10, 0, 10).isValid());
        assertFalse(new BoxConstraints(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0, 10).isValid());
        assertFalse(new BoxConstraints(Double.NaN, 10, 0, 10).isValid());
    }

    @Test
    void unboundedMaximumIsStillValid() {
        BoxConstraints constraints = BoxConstraints.tightFor(120.0, null);

        assertTrue(constraints.isValid());
        assertTrue(constraints.hasBoundedWidth());
        assertFalse(constraints.hasBoundedHeight());
        assertTrue(constraints.satisfies(new Size(120, 10_000)));
    }

    @Test
    void enforceKeepsResultInsideOther() {
        BoxConstraints outer = new BoxConstraints(10, 100, 10, 100);
        BoxConstraints enforced = new BoxConstraints(0, 500, 50, 60).enforce(outer);

        assertThat(enforced).isEqualTo(new BoxConstraints(10, 100, 50, 60));
    }

    @Test
    void axisHelpersSwapForVertical() {
        BoxConstraints constraints = BoxConstraints.of(Axis.VERTICAL, 1, 2, 3, 4);

        assertThat(constraints).isEqualTo(new BoxConstraints(3, 4, 1, 2));
        assertThat(constraints.maxAlong(Axis.VERTICAL)).isEqualTo(2);
        assertThat(constraints.minAlong(Axis.HORIZONTAL)).isEqualTo(3);
    }
}
