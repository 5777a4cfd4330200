package ir.ipaam.pdflayout.domain.geometry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlignmentTest {

    private static final Size CONTAINER = new Size(200, 100);
    private static final Size CHILD = new Size(50, 30);

    @Test
    void centerSplitsFreeSpaceEvenly() {
        assertThat(Alignment.CENTER.resolve(CONTAINER, CHILD)).isEqualTo(new Point(75, 35));
    }

    @Test
    void cornersPinToEdges() {
        assertThat(Alignment.TOP_LEFT.resolve(CONTAINER, CHILD)).isEqualTo(Point.ZERO);
        assertThat(Alignment.BOTTOM_RIGHT.resolve(CONTAINER, CHILD)).isEqualTo(new Point(150, 70));
    }

    @Test
    void mirroredFlipsHorizontalOnly() {
        assertThat(Alignment.TOP_LEFT.mirrored()).isEqualTo(Alignment.TOP_RIGHT);
        assertThat(Alignment.CENTER.mirrored()).isEqualTo(Alignment.CENTER);
        assertThat(Alignment.BOTTOM_RIGHT.mirrored()).isEqualTo(Alignment.BOTTOM_LEFT);
    }
}
