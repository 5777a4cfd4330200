package ir.ipaam.pdflayout.domain.layout;

import ir.ipaam.pdflayout.domain.geometry.EdgeInsets;
import ir.ipaam.pdflayout.domain.geometry.Rect;
import ir.ipaam.pdflayout.domain.geometry.Size;

public record PageGeometry(Size pageSize, EdgeInsets margins) {

    /**
     * Page rectangle left after subtracting the margins; the only area the layout tree lays out into.
     */
    public Rect contentArea() {
        return new Rect(
                margins.left(),
                margins.top(),
                pageSize.width() - margins.horizontal(),
                pageSize.height() - margins.vertical());
    }
}
