package ir.ipaam.pdflayout.domain.pdf;

public enum LineCap {
    BUTT(0),
    ROUND(1),
    SQUARE(2);

    private final int code;

    LineCap(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
