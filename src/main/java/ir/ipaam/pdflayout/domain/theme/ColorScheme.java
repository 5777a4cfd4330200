package ir.ipaam.pdflayout.domain.theme;

import ir.ipaam.pdflayout.domain.pdf.PdfColor;

public record ColorScheme(
        PdfColor primary,
        PdfColor secondary,
        PdfColor background,
        PdfColor surface,
        PdfColor onBackground,
        PdfColor onSurface,
        PdfColor error,
        PdfColor outline) {

    public static ColorScheme light() {
        return new ColorScheme(
                PdfColor.fromHex("#1976d2"),
                PdfColor.fromHex("#dc004e"),
                PdfColor.WHITE,
                PdfColor.WHITE,
                PdfColor.BLACK,
                PdfColor.BLACK,
                PdfColor.fromHex("#d32f2f"),
                PdfColor.fromHex("#bdbdbd"));
    }
}
