package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.exception.ConstraintViolationException;
import ir.ipaam.pdflayout.domain.exception.InvalidConstraintsException;
import ir.ipaam.pdflayout.domain.geometry.Axis;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.geometry.Size;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mediates layout calls: validates constraints going down and sizes coming back, and caches results per
 * (identity, constraints).
 * <p>
 * One instance per document. Not thread-safe. The cache is never invalidated automatically; callers clear it
 * before laying out a changed subtree again.
 */
@Slf4j
public class ConstraintSolver {

    private final Map<String, LayoutResult> layoutCache = new HashMap<>();
    private final LayoutInstrumentation instrumentation;

    public ConstraintSolver() {
        this(LayoutInstrumentation.NONE);
    }

    public ConstraintSolver(LayoutInstrumentation instrumentation) {
        this.instrumentation = instrumentation != null ? instrumentation : LayoutInstrumentation.NONE;
    }

    public LayoutResult solveLayout(Widget widget, LayoutContext context) {
        return solveLayout(widget, context, LayoutOptions.DEFAULT);
    }

    public LayoutResult solveLayout(Widget widget, LayoutContext context, LayoutOptions options) {
        BoxConstraints constraints = context.constraints();
        String id = widgetId(widget);
        String cacheKey = cacheKey(id, constraints);

        if (options.useCache()) {
            LayoutResult cached = layoutCache.get(cacheKey);
            if (cached != null) {
                log.trace("Layout cache hit for {}", cacheKey);
                return cached;
            }
        }

        if (options.validateConstraints() && !constraints.isValid()) {
            throw new InvalidConstraintsException(id, constraints);
        }

        long start = System.nanoTime();
        LayoutResult result = widget.layout(context);
        instrumentation.recordLayout(id, System.nanoTime() - start);

        if (options.validateConstraints() && !constraints.satisfies(result.size())) {
            throw new ConstraintViolationException(id, constraints, result.size());
        }

        if (options.useCache()) {
            layoutCache.put(cacheKey, result);
        }
        return result;
    }

    /**
     * Child constraints from the parent's plus the child's requirements. The result never leaves the parent's
     * range: fixed sizes are clamped into it, minimums never fall below the parent's, maximums never exceed it.
     */
    public BoxConstraints propagateConstraints(BoxConstraints parent, ChildRequirements requirements) {
        if (requirements.width() != null && requirements.height() != null) {
            return BoxConstraints.tight(parent.constrain(new Size(requirements.width(), requirements.height())));
        }

        double maxWidth = requirements.width() != null
                ? requirements.width()
                : requirements.maxWidth() != null ? requirements.maxWidth() : parent.maxWidth();
        double maxHeight = requirements.height() != null
                ? requirements.height()
                : requirements.maxHeight() != null ? requirements.maxHeight() : parent.maxHeight();

        maxWidth = parent.constrainWidth(maxWidth);
        maxHeight = parent.constrainHeight(maxHeight);

        double minWidth = Math.min(maxWidth, Math.max(orZero(requirements.minWidth()), parent.minWidth()));
        double minHeight = Math.min(maxHeight, Math.max(orZero(requirements.minHeight()), parent.minHeight()));

        return new BoxConstraints(minWidth, maxWidth, minHeight, maxHeight);
    }

    public Size negotiateSize(List<LayoutResult> children, BoxConstraints parent, SizingStrategy strategy) {
        return negotiateSize(children, parent, strategy, Axis.HORIZONTAL);
    }

    /**
     * Combines children's sizes under {@code strategy}. {@code mainAxis} only matters for {@link SizingStrategy#WRAP},
     * which sums along it and takes the maximum across it.
     */
    public Size negotiateSize(List<LayoutResult> children, BoxConstraints parent, SizingStrategy strategy,
                              Axis mainAxis) {
        if (children.isEmpty()) {
            return parent.smallest();
        }

        return switch (strategy) {
            case FIT -> {
                double width = 0;
                double height = 0;
                for (LayoutResult child : children) {
                    width = Math.max(width, child.size().width());
                    height = Math.max(height, child.size().height());
                }
                yield new Size(Math.min(width, parent.maxWidth()), Math.min(height, parent.maxHeight()));
            }
            case EXPAND -> new Size(
                    parent.hasBoundedWidth() ? parent.maxWidth() : parent.minWidth(),
                    parent.hasBoundedHeight() ? parent.maxHeight() : parent.minHeight());
            case WRAP -> {
                double main = 0;
                double cross = 0;
                for (LayoutResult child : children) {
                    main += child.size().along(mainAxis);
                    cross = Math.max(cross, child.size().across(mainAxis));
                }
                yield parent.constrain(Size.of(mainAxis, main, cross));
            }
        };
    }

    /**
     * Natural extent of {@code widget} along {@code axis}, measured by an extra uncached layout with that axis
     * relaxed to {@code [0, ∞)} and the other axis left as in {@code context}.
     */
    public IntrinsicDimension calculateIntrinsicDimensions(Widget widget, LayoutContext context, Axis axis) {
        BoxConstraints constraints = context.constraints();
        BoxConstraints relaxed = axis == Axis.HORIZONTAL
                ? new BoxConstraints(0, Double.POSITIVE_INFINITY, constraints.minHeight(), constraints.maxHeight())
                : new BoxConstraints(constraints.minWidth(), constraints.maxWidth(), 0, Double.POSITIVE_INFINITY);

        LayoutResult result = solveLayout(widget, context.withConstraints(relaxed), LayoutOptions.UNCACHED);
        double extent = result.size().along(axis);
        return new IntrinsicDimension(extent, extent);
    }

    public void clearCache() {
        layoutCache.clear();
    }

    public void clearCacheForWidget(Widget widget) {
        String prefix = widgetId(widget) + ":";
        layoutCache.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public int getCacheSize() {
        return layoutCache.size();
    }

    /**
     * Cache identity of a node: its key, else its debug label, else its class name.
     */
    public static String widgetId(Widget widget) {
        if (widget.getKey() != null) {
            return widget.getKey();
        }
        if (widget.getDebugLabel() != null) {
            return widget.getDebugLabel();
        }
        return widget.getClass().getSimpleName();
    }

    private static String cacheKey(String id, BoxConstraints constraints) {
        return id + ":" + constraints.minWidth() + ":" + constraints.maxWidth()
                + ":" + constraints.minHeight() + ":" + constraints.maxHeight();
    }

    private static double orZero(Double value) {
        return value != null ? value : 0;
    }
}
