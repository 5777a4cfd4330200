package ir.ipaam.pdflayout.domain.pdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class PdfPageList extends PdfObject {

    private final List<PdfPage> pages = new ArrayList<>();

    public PdfPageList(PdfDocument document) {
        super(document, "/Pages");
    }

    void add(PdfPage page) {
        pages.add(page);
    }

    public List<PdfPage> getPages() {
        return Collections.unmodifiableList(pages);
    }

    @Override
    protected void prepare() {
        PdfArray kids = new PdfArray(List.of());
        for (PdfPage page : pages) {
            kids.add(page.ref());
        }
        params.put("/Kids", kids);
        params.put("/Count", PdfNum.of(pages.size()));
    }
}
