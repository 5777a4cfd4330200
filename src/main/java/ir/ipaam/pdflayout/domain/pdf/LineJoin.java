package ir.ipaam.pdflayout.domain.pdf;

public enum LineJoin {
    MITER(0),
    ROUND(1),
    BEVEL(2);

    private final int code;

    LineJoin(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
