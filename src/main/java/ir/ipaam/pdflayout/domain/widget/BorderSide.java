package ir.ipaam.pdflayout.domain.widget;

import ir.ipaam.pdflayout.domain.pdf.PdfColor;

public record BorderSide(PdfColor color, double width) {

    public static BorderSide of(PdfColor color) {
        return new BorderSide(color, 1);
    }
}
