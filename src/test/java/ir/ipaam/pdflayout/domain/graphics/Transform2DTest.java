package ir.ipaam.pdflayout.domain.graphics;

import ir.ipaam.pdflayout.domain.geometry.Point;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class Transform2DTest {

    @Test
    void multiplyAppliesThisFirst() {
        Transform2D scaleThenMove = Transform2D.scaling(2, 2).multiply(Transform2D.translation(10, 0));

        assertThat(scaleThenMove.transformPoint(new Point(1, 1))).isEqualTo(new Point(12, 2));
    }

    @Test
    void inverseUndoesTransform() {
        Transform2D transform = Transform2D.rotationAround(0.7, 50, 50).multiply(Transform2D.scaling(3, 0.5));
        Point p = new Point(17, -4);

        Point back = transform.inverse().transformPoint(transform.transformPoint(p));

        assertThat(back.x()).isCloseTo(17, within(1e-9));
        assertThat(back.y()).isCloseTo(-4, within(1e-9));
        assertThat(transform.multiply(transform.inverse()).isIdentity()).isTrue();
    }

    @Test
    void singularTransformHasNoInverse() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> Transform2D.scaling(0, 1).inverse());

        assertThat(ex.getMessage()).contains("not invertible");
    }

    @Test
    void decomposesRotationAndScale() {
        Transform2D transform = Transform2D.scaling(2, 2).multiply(Transform2D.rotation(Math.PI / 4));

        assertThat(transform.getRotation()).isCloseTo(Math.PI / 4, within(1e-9));
        assertThat(transform.getScale().x()).isCloseTo(2, within(1e-9));
    }
}
