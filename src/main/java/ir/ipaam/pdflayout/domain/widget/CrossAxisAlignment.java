package ir.ipaam.pdflayout.domain.widget;

public enum CrossAxisAlignment {
    START,
    END,
    CENTER,
    STRETCH
}
