package ir.ipaam.pdflayout.domain.pdf;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PdfColorTest {

    @Test
    void parsesHexForms() {
        assertThat(PdfColor.fromHex("#ff0000")).isEqualTo(PdfColor.RED);
        assertThat(PdfColor.fromHex("#0F0")).isEqualTo(PdfColor.GREEN);
        assertThat(PdfColor.fromHex("800000ff")).isEqualTo(PdfColor.BLUE);
    }

    @Test
    void malformedHexIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> PdfColor.fromHex("#12"));

        assertThat(ex.getMessage()).contains("Malformed color");
        assertThrows(IllegalArgumentException.class, () -> PdfColor.fromHex("#zzzzzz"));
    }

    @Test
    void channelsAreClamped() {
        PdfColor color = new PdfColor(1.4, -0.2, Double.NaN);

        assertThat(color).isEqualTo(new PdfColor(1, 0, 0));
    }

    @Test
    void hexRoundTripsThroughInt() {
        assertThat(PdfColor.fromHex("#3366cc").toHex()).isEqualTo("#3366cc");
        assertThat(PdfColor.WHITE.isLight()).isTrue();
        assertThat(PdfColor.BLACK.isLight()).isFalse();
    }
}
