package ir.ipaam.pdflayout.domain.pdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class PdfPage extends PdfObject {

    private final PdfPageList parent;
    private final double width;
    private final double height;
    private final List<PdfContentStream> contents = new ArrayList<>();
    private final Set<PdfFont> fonts = new LinkedHashSet<>();

    PdfPage(PdfDocument document, PdfPageList parent, double width, double height) {
        super(document, "/Page");
        this.parent = parent;
        this.width = width;
        this.height = height;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    /**
     * Opens a new content stream on this page and returns a surface writing into it.
     */
    public PdfGraphics getGraphics() {
        PdfContentStream stream = new PdfContentStream(document);
        contents.add(stream);
        return new PdfGraphics(this, stream.getBuffer(), document.getSettings().verbose());
    }

    void useFont(PdfFont font) {
        fonts.add(font);
    }

    public Set<PdfFont> getFonts() {
        return Collections.unmodifiableSet(fonts);
    }

    @Override
    protected void prepare() {
        params.put("/Parent", parent.ref());
        params.put("/MediaBox", PdfArray.ofNumbers(0, 0, width, height));

        if (contents.size() == 1) {
            params.put("/Contents", contents.get(0).ref());
        } else if (!contents.isEmpty()) {
            PdfArray refs = new PdfArray(List.of());
            contents.forEach(stream -> refs.add(stream.ref()));
            params.put("/Contents", refs);
        }

        PdfDict resources = new PdfDict();
        resources.put("/ProcSet", PdfArray.of(PdfName.of("/PDF"), PdfName.of("/Text")));
        if (!fonts.isEmpty()) {
            PdfDict fontDict = new PdfDict();
            fonts.forEach(font -> fontDict.put(font.getResourceName(), font.ref()));
            resources.put("/Font", fontDict);
        }
        params.put("/Resources", resources);
    }
}
