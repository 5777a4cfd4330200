package ir.ipaam.pdflayout.domain.graphics;

import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Rect;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CoordinateSpaceTest {

    private static final double HEIGHT = 792;

    @Test
    void pointsFlipAgainstPageHeight() {
        assertThat(CoordinateSpace.screenToPdf(new Point(10, 20), HEIGHT)).isEqualTo(new Point(10, 772));
        assertThat(CoordinateSpace.pdfToScreen(new Point(10, 772), HEIGHT)).isEqualTo(new Point(10, 20));
    }

    @Test
    void pointRoundTripIsIdentity() {
        Point original = new Point(123.5, 456.25);

        Point back = CoordinateSpace.pdfToScreen(CoordinateSpace.screenToPdf(original, HEIGHT), HEIGHT);

        assertThat(back).isEqualTo(original);
    }

    @Test
    void rectOriginMovesToBottomLeft() {
        Rect pdf = CoordinateSpace.screenRectToPdf(new Rect(20, 20, 100, 50), HEIGHT);

        assertThat(pdf).isEqualTo(new Rect(20, 722, 100, 50));
        assertThat(CoordinateSpace.pdfRectToScreen(pdf, HEIGHT)).isEqualTo(new Rect(20, 20, 100, 50));
    }

    @Test
    void conjugatedTransformAgreesWithPointFlip() {
        Transform2D screen = Transform2D.rotation(Math.PI / 6).multiply(Transform2D.translation(40, 15));
        Transform2D pdf = CoordinateSpace.screenTransformToPdf(screen, HEIGHT);
        Point p = new Point(33, 71);

        Point expected = CoordinateSpace.screenToPdf(screen.transformPoint(p), HEIGHT);
        Point actual = pdf.transformPoint(CoordinateSpace.screenToPdf(p, HEIGHT));

        assertThat(actual.x()).isCloseTo(expected.x(), within(1e-9));
        assertThat(actual.y()).isCloseTo(expected.y(), within(1e-9));
    }

    @Test
    void screenTranslationBecomesNegatedPdfTranslation() {
        Transform2D pdf = CoordinateSpace.screenTransformToPdf(Transform2D.translation(20, 30), HEIGHT);

        assertThat(pdf.a()).isEqualTo(1);
        assertThat(pdf.b()).isCloseTo(0, within(1e-12));
        assertThat(pdf.c()).isCloseTo(0, within(1e-12));
        assertThat(pdf.d()).isEqualTo(1);
        assertThat(pdf.tx()).isEqualTo(20);
        assertThat(pdf.ty()).isEqualTo(-30);
    }

    @Test
    void unitConversions() {
        assertThat(CoordinateSpace.inchesToPoints(1)).isEqualTo(72);
        assertThat(CoordinateSpace.mmToPoints(25.4)).isCloseTo(72, within(1e-9));
        assertThat(CoordinateSpace.pixelsToPoints(96, 96)).isEqualTo(72);
        assertThat(CoordinateSpace.convertDpi(300, 300, 72)).isEqualTo(72);
    }
}
