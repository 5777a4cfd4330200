package ir.ipaam.pdflayout.domain.widget;

public enum StackFit {
    /** Non-positioned children get the stack's constraints loosened. */
    LOOSE,
    /** Non-positioned children are forced to the biggest size allowed. */
    EXPAND,
    /** Non-positioned children get the stack's constraints unchanged. */
    PASSTHROUGH
}
