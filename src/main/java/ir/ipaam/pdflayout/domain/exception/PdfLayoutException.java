package ir.ipaam.pdflayout.domain.exception;

/**
 * Base type for failures raised while laying out, painting or serializing a document.
 * None of them are retried; a failure aborts the page (or the whole document when saving).
 */
public abstract class PdfLayoutException extends RuntimeException {

    protected PdfLayoutException(String message) {
        super(message);
    }

    protected PdfLayoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
