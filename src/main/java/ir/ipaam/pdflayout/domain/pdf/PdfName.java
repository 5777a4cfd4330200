package ir.ipaam.pdflayout.domain.pdf;

public record PdfName(String value) implements PdfDataType {

    public PdfName {
        if (!value.startsWith("/")) {
            value = "/" + value;
        }
    }

    public static PdfName of(String value) {
        return new PdfName(value);
    }

    @Override
    public void output(PdfStream stream) {
        stream.putString(value);
    }
}
