package ir.ipaam.pdflayout.domain.pdf;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Growable byte buffer that tracks its write offset, used for both the file body and content streams.
 */
public class PdfStream {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    public PdfStream putString(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.ISO_8859_1);
        buffer.write(bytes, 0, bytes.length);
        return this;
    }

    public PdfStream putBytes(byte[] bytes) {
        buffer.write(bytes, 0, bytes.length);
        return this;
    }

    public PdfStream putByte(int value) {
        buffer.write(value);
        return this;
    }

    public PdfStream putStream(PdfStream other) {
        return putBytes(other.toByteArray());
    }

    public PdfStream putComment(String comment) {
        return putString("% " + comment.replace('\n', ' ').replace('\r', ' ') + "\n");
    }

    public int offset() {
        return buffer.size();
    }

    public boolean isEmpty() {
        return buffer.size() == 0;
    }

    public byte[] toByteArray() {
        return buffer.toByteArray();
    }

    @Override
    public String toString() {
        return buffer.toString(StandardCharsets.ISO_8859_1);
    }
}
