package ir.ipaam.pdflayout.domain.exception;

import lombok.Getter;

@Getter
public class UnbalancedGraphicsStateException extends PdfLayoutException {

    private final int expectedDepth;
    private final int actualDepth;

    public UnbalancedGraphicsStateException(String owner, int expectedDepth, int actualDepth) {
        super("Unbalanced graphics state after painting '" + owner + "': expected stack depth "
                + expectedDepth + " but was " + actualDepth);
        this.expectedDepth = expectedDepth;
        this.actualDepth = actualDepth;
    }
}
