package ir.ipaam.pdflayout.domain.exception;

import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;

public class InvalidConstraintsException extends ConstraintViolationException {

    public InvalidConstraintsException(String widgetId, BoxConstraints constraints) {
        super("Invalid constraints for widget '" + widgetId + "': " + constraints, widgetId, constraints, null);
    }
}
