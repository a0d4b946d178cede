package com.rulesentinel.core.wire;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats sample values for the wire.
 *
 * @since 1.0.0
 */
public final class SampleValues {

    /** Digits that always suffice to round-trip a {@code double}. */
    private static final int MAX_DIGITS = 17;

    private static final RoundingMode[] ROUNDING_ORDER = {
            RoundingMode.HALF_EVEN, RoundingMode.FLOOR, RoundingMode.CEILING };

    private SampleValues() {
        // utility class
    }

    /**
     * Format a value in scientific notation with the fewest digits that parse
     * back to the same {@code double}, e.g. {@code 1.5e+02}, {@code 2.3e-05},
     * {@code 0e+00}. Non-finite values are written as {@code NaN},
     * {@code +Inf} and {@code -Inf}.
     *
     * @param value sample value
     * @return formatted value
     */
    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        boolean negative = value < 0 || (value == 0 && 1 / value < 0);
        StringBuilder sb = new StringBuilder();
        if (negative) {
            sb.append('-');
        }
        if (value == 0) {
            return sb.append("0e+00").toString();
        }

        BigDecimal decimal = shortest(Math.abs(value));
        String digits = decimal.unscaledValue().toString();
        int exponent = digits.length() - 1 - decimal.scale();

        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int absExponent = Math.abs(exponent);
        if (absExponent < 10) {
            sb.append('0');
        }
        return sb.append(absExponent).toString();
    }

    /**
     * Closest decimal with the fewest significant digits that parses back to
     * {@code value}.
     */
    private static BigDecimal shortest(double value) {
        BigDecimal exact = new BigDecimal(value);
        for (int digits = 1; digits < MAX_DIGITS; digits++) {
            // nearest first, then either neighbour
            for (RoundingMode mode : ROUNDING_ORDER) {
                BigDecimal candidate = exact.round(new MathContext(digits, mode));
                if (candidate.doubleValue() == value) {
                    return candidate.stripTrailingZeros();
                }
            }
        }
        return exact.round(new MathContext(MAX_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    /**
     * Parse a value produced by {@link #format(double)}.
     *
     * @param value formatted value
     * @return the {@code double} it denotes
     * @throws NumberFormatException if {@code value} is not a number
     */
    public static double parse(String value) {
        return switch (value) {
            case "NaN" -> Double.NaN;
            case "+Inf", "Inf" -> Double.POSITIVE_INFINITY;
            case "-Inf" -> Double.NEGATIVE_INFINITY;
            default -> Double.parseDouble(value);
        };
    }
}
