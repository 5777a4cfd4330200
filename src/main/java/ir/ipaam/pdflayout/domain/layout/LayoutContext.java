package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.font.FontMetricsProvider;
import ir.ipaam.pdflayout.domain.geometry.BoxConstraints;
import ir.ipaam.pdflayout.domain.theme.ThemeData;

/**
 * Everything a node may read while laying out. Passed by value; composites derive one per child.
 */
public record LayoutContext(
        BoxConstraints constraints,
        TextDirection textDirection,
        ThemeData theme,
        FontMetricsProvider fontMetrics,
        ConstraintSolver solver) {

    public LayoutContext withConstraints(BoxConstraints constraints) {
        return new LayoutContext(constraints, textDirection, theme, fontMetrics, solver);
    }

    public LayoutContext withTheme(ThemeData theme) {
        return new LayoutContext(constraints, textDirection, theme, fontMetrics, solver);
    }

    public LayoutContext withTextDirection(TextDirection textDirection) {
        return new LayoutContext(constraints, textDirection, theme, fontMetrics, solver);
    }

    public boolean isRtl() {
        return textDirection == TextDirection.RTL;
    }

    /**
     * Lays out a child under {@code childConstraints}, validating both the constraints and the returned size.
     */
    public LayoutResult layoutChild(Widget child, BoxConstraints childConstraints) {
        return solver.solveLayout(child, withConstraints(childConstraints), LayoutOptions.UNCACHED);
    }
}
