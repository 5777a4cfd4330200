package ir.ipaam.pdflayout.domain.exception;

import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Size;
import lombok.Getter;

/**
 * A node reported a size outside the constraints it was given.
 */
@Getter
public class ConstraintViolationException extends PdfLayoutException {

    private final String widgetId;
    private final BoxConstraints constraints;
    private final Size size;

    public ConstraintViolationException(String widgetId, BoxConstraints constraints, Size size) {
        this("Widget '" + widgetId + "' returned size " + size.width() + "x" + size.height()
                + " which violates " + constraints, widgetId, constraints, size);
    }

    protected ConstraintViolationException(String message, String widgetId, BoxConstraints constraints, Size size) {
        super(message);
        this.widgetId = widgetId;
        this.constraints = constraints;
        this.size = size;
    }
}
