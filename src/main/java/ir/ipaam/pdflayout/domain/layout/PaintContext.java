package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.exception.UnbalancedGraphicsStateException;
import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.graphics.GraphicsContext;
import ir.ipaam.pdflayout.domain.graphics.Transform2D;
import ir.ipaam.pdflayout.domain.pdf.FontRegistry;
import ir.ipaam.pdflayout.domain.theme.ThemeData;

/**
 * Everything a node may read while painting.
 *
 * @param size     the node's own committed size
 * @param graphics authoring-space surface of the page being painted, valid only during the paint call
 */
public record PaintContext(
        Size size,
        ThemeData theme,
        GraphicsContext graphics,
        FontRegistry fonts,
        PageGeometry page) {

    public PaintContext withSize(Size size) {
        return new PaintContext(size, theme, graphics, fonts, page);
    }

    /**
     * Paints {@code child} inside its own save/restore bracket, translated to {@code offset}, and fails if the
     * child left the graphics stack at a different depth.
     */
    public void paintChild(Widget child, Size childSize, Point offset) {
        String id = ConstraintSolver.widgetId(child);
        int depth = graphics.getStackDepth();
        graphics.saveContext();
        if (offset.x() != 0 || offset.y() != 0) {
            graphics.setTransform(Transform2D.translation(offset.x(), offset.y()));
        }
        graphics.comment(id);
        child.paint(withSize(childSize));
        graphics.restoreContext();
        if (graphics.getStackDepth() != depth) {
            throw new UnbalancedGraphicsStateException(id, depth, graphics.getStackDepth());
        }
    }
}
