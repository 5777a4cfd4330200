package ir.ipaam.pdflayout.domain.layout;

public enum TextDirection {
    LTR,
    RTL
}
