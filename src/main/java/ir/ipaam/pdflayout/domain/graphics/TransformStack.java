package ir.ipaam.pdflayout.domain.graphics;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Running composition of nested transforms, used to compute absolute positions while walking a tree.
 */
public class TransformStack {

    private final Deque<Transform2D> stack = new ArrayDeque<>();
    private Transform2D current = Transform2D.IDENTITY;

    public void push(Transform2D transform) {
        stack.push(current);
        current = transform.multiply(current);
    }

    /**
     * Composes {@code transform} into the current matrix without opening a new level.
     */
    public void apply(Transform2D transform) {
        current = transform.multiply(current);
    }

    public Transform2D pop() {
        if (stack.isEmpty()) {
            throw new IllegalStateException("Cannot pop from an empty transform stack");
        }
        Transform2D popped = current;
        current = stack.pop();
        return popped;
    }

    public Transform2D current() {
        return current;
    }

    public int depth() {
        return stack.size();
    }

    public void clear() {
        stack.clear();
        current = Transform2D.IDENTITY;
    }
}
