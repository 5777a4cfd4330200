package ir.ipaam.pdflayout.domain.graphics;

import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Rect;

import java.util.List;

public final class BoundsCalculator {

    private BoundsCalculator() {
    }

    /**
     * Axis-aligned box enclosing the four transformed corners of {@code bounds}.
     */
    public static Rect transformBounds(Rect bounds, Transform2D transform) {
        List<Point> corners = List.of(
                transform.transformPoint(new Point(bounds.x(), bounds.y())),
                transform.transformPoint(new Point(bounds.right(), bounds.y())),
                transform.transformPoint(new Point(bounds.x(), bounds.bottom())),
                transform.transformPoint(new Point(bounds.right(), bounds.bottom())));

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point corner : corners) {
            minX = Math.min(minX, corner.x());
            minY = Math.min(minY, corner.y());
            maxX = Math.max(maxX, corner.x());
            maxY = Math.max(maxY, corner.y());
        }
        return new Rect(minX, minY, maxX - minX, maxY - minY);
    }

    public static boolean intersects(Rect first, Rect second) {
        return first.x() < second.right() && second.x() < first.right()
                && first.y() < second.bottom() && second.y() < first.bottom();
    }

    public static Rect union(Rect first, Rect second) {
        double left = Math.min(first.x(), second.x());
        double top = Math.min(first.y(), second.y());
        double right = Math.max(first.right(), second.right());
        double bottom = Math.max(first.bottom(), second.bottom());
        return new Rect(left, top, right - left, bottom - top);
    }
}
