package ir.ipaam.pdflayout.domain.pdf;

public record PdfIndirect(int serial, int generation) implements PdfDataType {

    @Override
    public void output(PdfStream stream) {
        stream.putString(serial + " " + generation + " R");
    }
}
