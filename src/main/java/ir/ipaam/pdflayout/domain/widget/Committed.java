package ir.ipaam.pdflayout.domain.widget;

/**
 * Holds what a widget committed during its last layout so paint can read it back.
 */
final class Committed<T> {

    private T value;

    void set(T value) {
        this.value = value;
    }

    T get() {
        if (value == null) {
            throw new IllegalStateException("paint called before layout");
        }
        return value;
    }
}
