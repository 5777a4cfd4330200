package ir.ipaam.pdflayout.domain.pdf;

/**
 * Indirect object owned by a {@link PdfDocument}. The serial number is assigned on construction.
 */
public abstract class PdfObject {

    protected final PdfDocument document;
    protected final PdfDict params = new PdfDict();
    private final int serial;
    private final int generation;

    protected PdfObject(PdfDocument document, String type) {
        this.document = document;
        this.serial = document.register(this);
        this.generation = 0;
        if (type != null) {
            params.put("/Type", PdfName.of(type));
        }
    }

    public int getSerial() {
        return serial;
    }

    public int getGeneration() {
        return generation;
    }

    public PdfDocument getDocument() {
        return document;
    }

    public PdfIndirect ref() {
        return new PdfIndirect(serial, generation);
    }

    /**
     * Refreshes the dictionary from current state right before the object is written.
     */
    protected void prepare() {
    }

    protected void writeContent(PdfStream stream) {
        params.output(stream);
    }

    final void write(PdfStream stream) {
        prepare();
        stream.putString(serial + " " + generation + " obj\n");
        writeContent(stream);
        stream.putString("\nendobj\n");
    }
}
