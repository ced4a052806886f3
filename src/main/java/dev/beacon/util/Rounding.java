package dev.beacon.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding for reported scores and durations.
 */
public final class Rounding {

    private Rounding() {
    }

    /**
     * Round half-up on the decimal representation, so 74.25 becomes 74.3 rather than drifting on binary error.
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
