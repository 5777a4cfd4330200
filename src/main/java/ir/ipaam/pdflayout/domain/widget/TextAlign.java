package ir.ipaam.pdflayout.domain.widget;

public enum TextAlign {
    LEFT,
    RIGHT,
    CENTER,
    /** Left for left-to-right text, right for right-to-left. */
    START,
    END
}
