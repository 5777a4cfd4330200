package ir.ipaam.pdflayout.domain.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BidiTextUtilsTest {

    @Test
    void detectsRightToLeftScripts() {
        assertThat(BidiTextUtils.containsRtl("سلام")).isTrue();
        assertThat(BidiTextUtils.containsRtl("שלום")).isTrue();
        assertThat(BidiTextUtils.containsRtl("hello")).isFalse();
        assertThat(BidiTextUtils.containsRtl(null)).isFalse();
    }

    @Test
    void latinTextIsLeftAlone() {
        assertThat(BidiTextUtils.toVisualOrder("plain text", false)).isEqualTo("plain text");
    }

    @Test
    void hebrewRunIsReversed() {
        assertThat(BidiTextUtils.toVisualOrder("אבג", true)).isEqualTo("גבא");
    }

    @Test
    void bracketsAreMirroredInsideRightToLeftRuns() {
        assertThat(BidiTextUtils.toVisualOrder("א(ב)", true)).isEqualTo("(ב)א");
    }
}
