package io.safecalc.standalone.adapter;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns an exact engine result into display text.
 *
 * <p>
 * Integral values print without a fractional part, in full ({@code 4},
 * {@code 100000000000000000000}); negative zero prints as {@code 0}. Other
 * values are rounded half-to-even on their exact binary value to
 * {@code precision} decimal places and trailing zeros are dropped. Non-finite
 * values print as {@code inf}, {@code -inf} and {@code nan}.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class ResultFormatter {

    static final String INFINITY = "inf";
    static final String NEGATIVE_INFINITY = "-inf";
    static final String NOT_A_NUMBER = "nan";

    private final int precision;

    public ResultFormatter(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must not be negative, got: " + precision);
        }
        this.precision = precision;
    }

    public String format(double value) {
        String nonFinite = nonFinite(value);
        if (nonFinite != null) {
            return nonFinite;
        }
        BigDecimal exact = new BigDecimal(value);
        if (value == Math.rint(value)) {
            return exact.toBigInteger().toString();
        }
        BigDecimal rounded = exact.setScale(precision, RoundingMode.HALF_EVEN);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    /** Text for a non-finite value, or {@code null} if the value is finite. */
    static String nonFinite(double value) {
        if (Double.isNaN(value)) {
            return NOT_A_NUMBER;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? INFINITY : NEGATIVE_INFINITY;
        }
        return null;
    }

    public int precision() {
        return precision;
    }
}
