package ir.ipaam.pdflayout.domain.pdf;

import ir.ipaam.pdflayout.domain.font.StandardFont;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;

/**
 * Standard Type1 font resource. Text shown with it is encoded as WinAnsi; characters outside that set become {@code ?}.
 */
public class PdfFont extends PdfObject {

    private static final Charset WIN_ANSI = Charset.forName("windows-1252");

    private final StandardFont font;
    private final String resourceName;

    PdfFont(PdfDocument document, StandardFont font, String resourceName) {
        super(document, "/Font");
        this.font = font;
        this.resourceName = resourceName;
        params.put("/Subtype", PdfName.of("/Type1"));
        params.put("/BaseFont", PdfName.of(font.getBaseFont()));
        if (!font.isSymbolic()) {
            params.put("/Encoding", PdfName.of("/WinAnsiEncoding"));
        }
    }

    public StandardFont getFont() {
        return font;
    }

    /**
     * Resource name used by the {@code Tf} operator, e.g. {@code /F1}.
     */
    public String getResourceName() {
        return resourceName;
    }

    public byte[] encode(String text) {
        CharsetEncoder encoder = WIN_ANSI.newEncoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .replaceWith(new byte[]{'?'});
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new IllegalStateException("Failed to encode text for " + font.getBaseFont(), e);
        }
    }
}
