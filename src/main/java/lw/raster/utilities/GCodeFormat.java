package lw.raster.utilities;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number formatting for emitted commands and header values.
 * Output never depends on the default locale.
 */
public final class GCodeFormat {

    /** Decimals kept when printing header values */
    private static final int HEADER_SCALE = 10;

    private GCodeFormat() {
    }

    /**
     * Formats a value with a fixed number of decimals, rounding half up.
     *
     * @param value    the value
     * @param decimals number of decimals, 0 for an integer
     * @return e.g. {@code fixed(0.15000000000000002, 2)} gives {@code "0.15"}
     */
    public static String fixed(double value, int decimals) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite value: " + value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP);
        if (rounded.signum() == 0) {
            rounded = rounded.abs();
        }
        return rounded.toPlainString();
    }

    /**
     * Formats a value for human-readable output: at most ten decimals, trailing zeros removed.
     *
     * @param value the value
     * @return e.g. {@code "10"} for 10.000000000000002 and {@code "0.1"} for 0.1
     */
    public static String plain(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(HEADER_SCALE, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }
}
