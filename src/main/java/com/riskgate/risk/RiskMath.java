package com.riskgate.risk;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric conventions shared by the guards.
 *
 * <p>Callers mix fractions (0.25) and percentages (25) for the same quantity. Any magnitude above
 * 1 is read as a percentage. Existing callers depend on this, so it applies to thresholds and
 * observed values alike.
 */
public final class RiskMath {

    private RiskMath() {}

    /** |x| as a 0..1 fraction: {@code |x| > 1 ? |x| / 100 : |x|}. */
    public static double normalizeFraction(double value) {
        double magnitude = Math.abs(value);
        return magnitude > 1.0 ? magnitude / 100.0 : magnitude;
    }

    /** Same as {@link #normalizeFraction(double)} but keeps the sign of the input. */
    public static double normalizeSignedFraction(double value) {
        double magnitude = normalizeFraction(value);
        return value >= 0 ? magnitude : -magnitude;
    }

    /**
     * Reads a number from a loosely typed value: any {@link Number}, or a string holding a decimal.
     * Returns null for everything else, including booleans.
     */
    public static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.valueOf(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Whole-number part of a reported count, truncated toward zero, without narrowing: a
     * {@link Long} or {@link BigInteger} keeps every digit. Returns null for NaN and infinities.
     */
    public static BigInteger toWholeNumber(Number value) {
        if (value instanceof BigInteger integer) {
            return integer;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toBigInteger();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d).toBigInteger();
        }
        return BigInteger.valueOf(value.longValue());
    }

    /**
     * Renders a number for a reason string: plain notation with at least one decimal place
     * ({@code 0.0001}, {@code 25.0}) for decimal exponents in [-4, 16), otherwise scientific with a
     * signed two-digit exponent ({@code 1e-05}, {@code 1e+16}).
     */
    public static String formatDecimal(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return 1.0 / value < 0 ? "-0.0" : "0.0";
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
        String digits = decimal.unscaledValue().abs().toString();
        StringBuilder text = new StringBuilder();
        if (decimal.signum() < 0) {
            text.append('-');
        }
        text.append(digits.charAt(0));
        if (digits.length() > 1) {
            text.append('.').append(digits, 1, digits.length());
        }
        text.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            text.append('0');
        }
        return text.append(magnitude).toString();
    }
}
