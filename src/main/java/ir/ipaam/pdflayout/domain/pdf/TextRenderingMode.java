package ir.ipaam.pdflayout.domain.pdf;

public enum TextRenderingMode {
    FILL(0),
    STROKE(1),
    FILL_AND_STROKE(2),
    INVISIBLE(3),
    FILL_AND_CLIP(4),
    STROKE_AND_CLIP(5),
    FILL_STROKE_AND_CLIP(6),
    CLIP(7);

    private final int code;

    TextRenderingMode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
