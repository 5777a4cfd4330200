package ir.ipaam.pdflayout.domain.pdf;

/**
 * A value that can be written in PDF object syntax.
 */
@FunctionalInterface
public interface PdfDataType {

    void output(PdfStream stream);

    default String toPdfString() {
        PdfStream stream = new PdfStream();
        output(stream);
        return stream.toString();
    }
}
