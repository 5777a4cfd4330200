package ir.ipaam.pdflayout.application.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TextFileDecoderTest {

    @Test
    void emptyInputDecodesToEmptyString() {
        assertEquals("", TextFileDecoder.decode(new byte[0]));
        assertEquals("", TextFileDecoder.decode(null));
    }

    @Test
    void utf8ByteOrderMarkIsStripped() {
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "Plain text upload".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, bytes, 0, bom.length);
        System.arraycopy(body, 0, bytes, bom.length, body.length);

        assertEquals("Plain text upload", TextFileDecoder.decode(bytes));
    }

    @Test
    void decodesPersianUtf8() {
        String text = "این یک متن آزمایشی فارسی است که برای تشخیص نوع کدگذاری نوشته شده است.";

        String decoded = TextFileDecoder.decode(text.getBytes(StandardCharsets.UTF_8));

        assertEquals(text, decoded);
    }

    @Test
    void stripBomLeavesOtherTextAlone() {
        assertThat(TextFileDecoder.stripBom("\uFEFFabc")).isEqualTo("abc");
        assertThat(TextFileDecoder.stripBom("abc")).isEqualTo("abc");
        assertThat(TextFileDecoder.stripBom("")).isEmpty();
    }
}
