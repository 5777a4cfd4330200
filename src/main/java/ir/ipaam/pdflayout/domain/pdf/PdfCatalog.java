package ir.ipaam.pdflayout.domain.pdf;

public class PdfCatalog extends PdfObject {

    public PdfCatalog(PdfDocument document, PdfPageList pages) {
        super(document, "/Catalog");
        params.put("/Pages", pages.ref());
    }
}
