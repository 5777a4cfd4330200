package ir.ipaam.pdflayout.domain.pdf;

import java.io.ByteArrayOutputStream;
import java.util.zip.Deflater;

/**
 * Content stream object. Operators are appended to {@link #getBuffer()} by a {@link PdfGraphics}.
 */
public class PdfContentStream extends PdfObject {

    private final PdfStream buffer = new PdfStream();
    private byte[] encoded = new byte[0];

    public PdfContentStream(PdfDocument document) {
        super(document, null);
    }

    public PdfStream getBuffer() {
        return buffer;
    }

    @Override
    protected void prepare() {
        byte[] raw = buffer.toByteArray();
        if (document.getSettings().compress()) {
            encoded = deflate(raw);
            params.put("/Filter", PdfName.of("/FlateDecode"));
        } else {
            encoded = raw;
            params.remove("/Filter");
        }
        params.put("/Length", PdfNum.of(encoded.length));
    }

    @Override
    protected void writeContent(PdfStream stream) {
        params.output(stream);
        stream.putString("\nstream\n");
        stream.putBytes(encoded);
        stream.putString("\nendstream");
    }

    private static byte[] deflate(byte[] raw) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(raw);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
            byte[] chunk = new byte[4096];
            while (!deflater.finished()) {
                int count = deflater.deflate(chunk);
                out.write(chunk, 0, count);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }
}
