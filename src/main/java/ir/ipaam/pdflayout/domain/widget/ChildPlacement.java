package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.geometry.Point;
import ir.ipaam.pdflayout.domain.geometry.Size;
import ir.ipaam.pdflayout.domain.layout.PaintContext;
import ir.ipaam.pdflayout.domain.layout.Widget;

/**
 * Size and top-left offset of a child, relative to its parent.
 */
record ChildPlacement(Widget widget, Size size, Point offset) {

    void paint(PaintContext context) {
        context.paintChild(widget, size, offset);
    }
}
