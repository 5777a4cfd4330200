package ir.ipaam.pdflayout.domain.exception;

public class SerializationFailureException extends PdfLayoutException {

    public SerializationFailureException(String message) {
        super(message);
    }

    public SerializationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
