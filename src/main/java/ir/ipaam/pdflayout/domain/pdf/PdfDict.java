package ir.ipaam.pdflayout.domain.pdf;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dictionary keeping insertion order so the serialized form is deterministic.
 */
public class PdfDict implements PdfDataType {

    private final Map<String, PdfDataType> entries = new LinkedHashMap<>();

    public PdfDict put(String key, PdfDataType value) {
        entries.put(PdfName.of(key).value(), value);
        return this;
    }

    public PdfDataType get(String key) {
        return entries.get(PdfName.of(key).value());
    }

    public boolean containsKey(String key) {
        return entries.containsKey(PdfName.of(key).value());
    }

    public PdfDict remove(String key) {
        entries.remove(PdfName.of(key).value());
        return this;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public void output(PdfStream stream) {
        stream.putString("<< ");
        for (Map.Entry<String, PdfDataType> entry : entries.entrySet()) {
            stream.putString(entry.getKey()).putString(" ");
            entry.getValue().output(stream);
            stream.putString(" ");
        }
        stream.putString(">>");
    }
}
