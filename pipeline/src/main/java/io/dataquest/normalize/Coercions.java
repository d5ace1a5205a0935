package io.dataquest.normalize;

import java.util.regex.Pattern;

/**
 * Lenient cell conversions. Anything that does not read as a plain decimal number becomes null; callers
 * decide what null means for their aggregate.
 */
public final class Coercions {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private Coercions() {}

    public static Double toDouble(Object cell) {
        double d;
        if (cell == null) return null;
        if (cell instanceof Number n) {
            d = n.doubleValue();
        } else if (cell instanceof CharSequence cs) {
            String s = cs.toString().strip();
            if (!DECIMAL.matcher(s).matches()) return null;
            d = Double.parseDouble(s);
        } else {
            return null;
        }
        return Double.isFinite(d) ? d : null;
    }

    /** Whole numbers only: {@code "2015"}, {@code 2015L} and {@code 2015.0} read as 2015; {@code 2015.5} is null. */
    public static Integer toYear(Object cell) {
        if (cell instanceof Integer i) return i;
        Double d = toDouble(cell);
        if (d == null || d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) return null;
        return d.intValue();
    }

    public static Object trimText(Object cell) {
        return cell instanceof String s ? s.strip() : cell;
    }
}
