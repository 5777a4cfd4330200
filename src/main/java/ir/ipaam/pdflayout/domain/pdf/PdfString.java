package ir.ipaam.pdflayout.domain.pdf;

import java.nio.charset.StandardCharsets;

/**
 * Literal string {@code (...)} holding raw bytes.
 */
public final class PdfString implements PdfDataType {

    private final byte[] bytes;

    private PdfString(byte[] bytes) {
        this.bytes = bytes;
    }

    public static PdfString of(String text) {
        return new PdfString(text.getBytes(StandardCharsets.ISO_8859_1));
    }

    public static PdfString ofBytes(byte[] bytes) {
        return new PdfString(bytes.clone());
    }

    @Override
    public void output(PdfStream stream) {
        stream.putByte('(');
        stream.putBytes(escape(bytes));
        stream.putByte(')');
    }

    static byte[] escape(byte[] raw) {
        PdfStream out = new PdfStream();
        for (byte b : raw) {
            switch (b) {
                case '\\' -> out.putString("\\\\");
                case '(' -> out.putString("\\(");
                case ')' -> out.putString("\\)");
                case '\r' -> out.putString("\\r");
                case '\n' -> out.putString("\\n");
                case '\t' -> out.putString("\\t");
                default -> out.putByte(b);
            }
        }
        return out.toByteArray();
    }
}
