package ir.ipaam.pdflayout.application.util;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Decodes uploaded plain-text bytes, guessing the charset when the client does not declare one.
 */
@Slf4j
public final class TextFileDecoder {

    private TextFileDecoder() {
    }

    public static String decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return "";
        }
        Charset charset = detectCharset(bytes);
        return stripBom(new String(bytes, charset));
    }

    static Charset detectCharset(byte[] bytes) {
        CharsetDetector detector = new CharsetDetector();
        detector.setText(bytes);
        CharsetMatch match = detector.detect();
        if (match == null || match.getName() == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(match.getName());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            log.debug("Detected charset {} is not available, using UTF-8", match.getName());
            return StandardCharsets.UTF_8;
        }
    }

    static String stripBom(String input) {
        if (!input.isEmpty() && input.charAt(0) == '\uFEFF') {
            return input.substring(1);
        }
        return input;
    }
}
