package ir.ipaam.pdflayout.domain.widget;

public enum MainAxisAlignment {
    START,
    END,
    CENTER,
    SPACE_BETWEEN,
    SPACE_AROUND,
    SPACE_EVENLY
}
