package ir.ipaam.pdflayout.domain.widget;

public enum MainAxisSize {
    MIN,
    MAX
}
