package io.dataquest.bls;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Renders numbers the way the report consumers have always seen them: the shortest decimal that reads back
 * as the same double, {@code .0} on integral values, and exponent notation outside {@code [1e-4, 1e16)}.
 */
public final class ReportNumbers {
    private ReportNumbers() {}

    /** {@code null} renders as the empty string (an empty CSV field). */
    public static String cell(Double value) {
        return value == null ? "" : decimal(value);
    }

    public static String cell(Integer value) {
        return value == null ? "" : value.toString();
    }

    /** {@code null} renders as {@code nan}. */
    public static String stat(Double value) {
        return value == null ? "nan" : decimal(value);
    }

    public static String decimal(double v) {
        if (Double.isNaN(v)) return "nan";
        if (Double.isInfinite(v)) return v > 0 ? "inf" : "-inf";
        if (v == 0.0) return (1.0 / v) < 0 ? "-0.0" : "0.0";

        BigDecimal shortest = shortest(v);
        String digits = shortest.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - shortest.scale(); // power of ten of the leading digit
        String sign = v < 0 ? "-" : "";

        if (exponent < -4 || exponent >= 16) {
            String mantissa = digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
            String exp = String.format("%02d", Math.abs(exponent));
            return sign + mantissa + "e" + (exponent < 0 ? "-" : "+") + exp;
        }
        if (exponent < 0) {
            return sign + "0." + "0".repeat(-exponent - 1) + digits;
        }
        int intLen = exponent + 1;
        if (digits.length() <= intLen) {
            return sign + digits + "0".repeat(intLen - digits.length()) + ".0";
        }
        return sign + digits.substring(0, intLen) + "." + digits.substring(intLen);
    }

    private static BigDecimal shortest(double v) {
        BigDecimal exact = new BigDecimal(v);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (rounded.doubleValue() == v) return rounded.stripTrailingZeros();
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }
}
