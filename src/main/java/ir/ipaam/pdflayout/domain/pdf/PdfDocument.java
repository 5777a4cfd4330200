package ir.ipaam.pdflayout.domain.pdf;

import ir.ipaam.pdflayout.domain.exception.SerializationFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Object table of a PDF file. Owns the catalog, page tree, info dictionary and font resources.
 */
@Slf4j
public class PdfDocument {

    private static final byte[] BINARY_MARKER = {'%', (byte) 0xE2, (byte) 0xE3, (byte) 0xCF, (byte) 0xD3, '\n'};

    private final List<PdfObject> objects = new ArrayList<>();
    private final PdfDocumentSettings settings;
    private final FontRegistry fontRegistry;
    private final PdfInfo info;
    private final PdfPageList pageList;
    private final PdfCatalog catalog;
    private int serialCounter;

    public PdfDocument() {
        this(PdfDocumentSettings.defaults(), DocumentInfo.empty());
    }

    public PdfDocument(PdfDocumentSettings settings, DocumentInfo documentInfo) {
        this.settings = settings;
        this.fontRegistry = new FontRegistry(this);
        this.info = new PdfInfo(this, documentInfo);
        this.pageList = new PdfPageList(this);
        this.catalog = new PdfCatalog(this, pageList);
    }

    int register(PdfObject object) {
        objects.add(object);
        return ++serialCounter;
    }

    public PdfDocumentSettings getSettings() {
        return settings;
    }

    public FontRegistry getFontRegistry() {
        return fontRegistry;
    }

    public PdfPage addPage(double width, double height) {
        if (!(width > 0) || !(height > 0) || !Double.isFinite(width) || !Double.isFinite(height)) {
            throw new IllegalArgumentException("Page size must be positive and finite, got " + width + "x" + height);
        }
        PdfPage page = new PdfPage(this, pageList, width, height);
        pageList.add(page);
        return page;
    }

    public List<PdfPage> getPages() {
        return pageList.getPages();
    }

    public List<PdfObject> getObjects() {
        return Collections.unmodifiableList(objects);
    }

    /**
     * Serializes the whole object table. Output depends only on the document state, so calling it again
     * yields the same bytes.
     */
    public byte[] save() {
        verifyResources();

        PdfStream out = new PdfStream();
        out.putString("%PDF-" + settings.version() + "\n");
        out.putBytes(BINARY_MARKER);

        List<PdfObject> ordered = new ArrayList<>(objects);
        ordered.sort(Comparator.comparingInt(PdfObject::getSerial));
        List<Integer> offsets = new ArrayList<>(ordered.size());
        for (PdfObject object : ordered) {
            offsets.add(out.offset());
            object.write(out);
        }

        int xrefOffset = out.offset();
        out.putString("xref\n");
        out.putString("0 " + (ordered.size() + 1) + "\n");
        out.putString("0000000000 65535 f \n");
        for (int i = 0; i < ordered.size(); i++) {
            out.putString(String.format(Locale.ROOT, "%010d %05d n \n", offsets.get(i), ordered.get(i).getGeneration()));
        }

        PdfDict trailer = new PdfDict()
                .put("/Size", PdfNum.of(ordered.size() + 1))
                .put("/Root", catalog.ref())
                .put("/Info", info.ref());
        out.putString("trailer\n");
        trailer.output(out);
        out.putString("\nstartxref\n" + xrefOffset + "\n%%EOF\n");

        byte[] bytes = out.toByteArray();
        log.debug("Serialized {} objects across {} pages into {} bytes", ordered.size(), getPages().size(), bytes.length);
        return bytes;
    }

    private void verifyResources() {
        for (PdfPage page : getPages()) {
            for (PdfFont font : page.getFonts()) {
                if (font.getDocument() != this || !fontRegistry.contains(font)) {
                    throw new SerializationFailureException("Page " + page.getSerial() + " references font "
                            + font.getResourceName() + " (" + font.getFont().getBaseFont()
                            + ") that is not registered in this document");
                }
            }
        }
    }
}
