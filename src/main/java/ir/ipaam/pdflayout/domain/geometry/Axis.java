package ir.ipaam.pdflayout.domain.geometry;

public enum Axis {
    HORIZONTAL,
    VERTICAL;

    public Axis flip() {
        return this == HORIZONTAL ? VERTICAL : HORIZONTAL;
    }
}
