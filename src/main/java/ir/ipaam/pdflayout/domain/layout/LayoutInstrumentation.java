package ir.ipaam.pdflayout.domain.layout;

/**
 * Sink the solver reports the duration of every actual (non-cached) layout call to.
 */
@FunctionalInterface
public interface LayoutInstrumentation {

    LayoutInstrumentation NONE = (widgetId, nanos) -> {
    };

    void recordLayout(String widgetId, long nanos);
}
