package ir.ipaam.pdflayout.domain.widget;

public enum FlexFit {
    /** The child must fill its share of the free space. */
    TIGHT,
    /** The child may be smaller than its share. */
    LOOSE
}
