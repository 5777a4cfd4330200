package ir.ipaam.pdflayout.domain.layout;

/**
 * How a composite combines its children's sizes into its own.
 */
public enum SizingStrategy {
    /** Bounding box of the children, capped at the parent's maximum. */
    FIT,
    /** Parent's maximum, or its minimum on an unbounded axis. */
    EXPAND,
    /** Children summed along the main axis and maxed across it, clamped into the parent's range. */
    WRAP
}
