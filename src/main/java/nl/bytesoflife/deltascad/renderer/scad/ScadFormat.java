package nl.bytesoflife.deltascad.renderer.scad;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Number and layout formatting shared by every rendered statement.
 *
 * Two numeric styles exist and are not interchangeable:
 * {@link #fixed2(double)} is the two-decimal display format used by vectors,
 * {@link #number(double)} keeps full precision and is used for raw geometry.
 * Both always use a dot as decimal separator.
 */
public final class ScadFormat {

    public static final String NEWLINE = "\n";
    public static final String INDENT = "    ";
    public static final String TERMINATOR = ";";

    // 17 significant digits always identify a double
    private static final int MAX_SIGNIFICANT_DIGITS = 17;

    private ScadFormat() {
    }

    /**
     * Format with exactly two decimals, e.g. {@code 1.00}.
     */
    public static String fixed2(double value) {
        String formatted = String.format(Locale.US, "%.2f", value);
        // -0.001 rounds to "-0.00"
        if (formatted.equals("-0.00")) {
            return "0.00";
        }
        return formatted;
    }

    /**
     * Format without losing precision, using the fewest significant digits that
     * still parse back to the same double: {@code 1}, {@code 0.1},
     * {@code 282879384806159000}. Exponent notation is never used and negative
     * zero keeps its sign ({@code -0}).
     */
    public static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == 0) {
            return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
        }
        BigDecimal exact = new BigDecimal(value);
        for (int digits = 1; digits < MAX_SIGNIFICANT_DIGITS; digits++) {
            BigDecimal candidate = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == value) {
                return candidate.stripTrailingZeros().toPlainString();
            }
        }
        return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN))
                .stripTrailingZeros().toPlainString();
    }

    /**
     * Quote a string literal for the script, escaping backslashes and quotes.
     */
    public static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * Indent every non-empty line of {@code text} by one level. A trailing
     * line break is preserved.
     */
    public static String indent(String text) {
        if (text.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length() + INDENT.length() * 4);
        int start = 0;
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            int lineEnd = end < 0 ? text.length() : end;
            if (lineEnd > start) {
                sb.append(INDENT);
            }
            sb.append(text, start, lineEnd);
            if (end < 0) {
                break;
            }
            sb.append(NEWLINE);
            start = end + 1;
        }
        return sb.toString();
    }
}
