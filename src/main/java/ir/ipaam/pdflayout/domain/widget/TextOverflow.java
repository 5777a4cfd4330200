package ir.ipaam.pdflayout.domain.widget;

public enum TextOverflow {
    CLIP,
    ELLIPSIS
}
