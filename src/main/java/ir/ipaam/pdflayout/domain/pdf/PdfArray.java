package ir.ipaam.pdflayout.domain.pdf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class PdfArray implements PdfDataType {

    private final List<PdfDataType> values = new ArrayList<>();

    public PdfArray(List<? extends PdfDataType> values) {
        this.values.addAll(values);
    }

    public static PdfArray of(PdfDataType... values) {
        return new PdfArray(Arrays.asList(values));
    }

    public static PdfArray ofNumbers(double... numbers) {
        PdfArray array = new PdfArray(List.of());
        for (double number : numbers) {
            array.add(PdfNum.of(number));
        }
        return array;
    }

    public PdfArray add(PdfDataType value) {
        values.add(value);
        return this;
    }

    public List<PdfDataType> values() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public void output(PdfStream stream) {
        stream.putString("[");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                stream.putString(" ");
            }
            values.get(i).output(stream);
        }
        stream.putString("]");
    }
}
