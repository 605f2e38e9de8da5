package de.bsommerfeld.fdf.export;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Plain decimal rendering of coordinates: fixed maximum precision, no
 * exponent, no trailing zeros, no negative zero.
 */
final class NumberFormatting {

    private final int decimalPlaces;

    NumberFormatting(int decimalPlaces) {
        this.decimalPlaces = Math.max(0, decimalPlaces);
    }

    String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            return "0";
        BigDecimal rounded = BigDecimal.valueOf(value)
                .setScale(decimalPlaces, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        if (rounded.signum() == 0)
            return "0";
        return rounded.toPlainString();
    }
}
