package ir.ipaam.pdflayout.domain.pdf;

import ir.ipaam.pdflayout.domain.exception.SerializationFailureException;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record PdfNum(double value) implements PdfDataType {

    public static PdfNum of(double value) {
        return new PdfNum(value);
    }

    @Override
    public void output(PdfStream stream) {
        stream.putString(format(value));
    }

    /**
     * Integers print plainly, everything else with at most six decimals and no trailing zeros.
     */
    public static String format(double value) {
        if (!Double.isFinite(value)) {
            throw new SerializationFailureException("Cannot serialize non-finite number " + value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }
}
