/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.flat.aggregate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats aggregate annotations with as few decimals as keep them visually distinct.
 *
 * <p>The fractional part is rounded (half up) at its first significant digit, so
 * {@code 1.111} and {@code 1.2} print as {@code 1.1} and {@code 1.2}, while {@code 1.011}
 * prints as {@code 1.01}. Whole numbers print without decimals and values of a billion or
 * more switch to one-decimal scientific notation ({@code 1.2e9}).</p>
 */
public final class MinimalPrecision {

    private static final double SCIENTIFIC_THRESHOLD = 1e9;
    private static final MathContext SCIENTIFIC = new MathContext(2, RoundingMode.HALF_EVEN);

    private MinimalPrecision() {
    }

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value >= SCIENTIFIC_THRESHOLD) {
            return scientific(value);
        }

        BigDecimal magnitude = BigDecimal.valueOf(Math.abs(value));
        BigDecimal whole = magnitude.setScale(0, RoundingMode.DOWN);
        BigDecimal fraction = magnitude.subtract(whole);
        BigDecimal rounded;

        if (fraction.signum() == 0) {
            rounded = whole;
        }
        else {
            int leadingZeros = fraction.scale() - fraction.precision();
            rounded = magnitude.setScale(leadingZeros + 1, RoundingMode.HALF_UP);
        }

        String digits = rounded.signum() == 0 ? "0" : rounded.stripTrailingZeros().toPlainString();
        return value < 0 && !"0".equals(digits) ? "-" + digits : digits;
    }

    private static String scientific(double value) {
        BigDecimal rounded = new BigDecimal(value).round(SCIENTIFIC);
        int exponent = rounded.precision() - rounded.scale() - 1;
        String mantissa = rounded.unscaledValue().toString();
        if (mantissa.length() == 1) {
            mantissa = mantissa + "0";
        }
        return mantissa.charAt(0) + "." + mantissa.charAt(1) + "e" + exponent;
    }
}
