package com.dmn.feel.value;

import java.math.BigDecimal;

/**
 * FEEL number, held as a double.
 */
public record NumberValue(double value) implements Value {

    public boolean isIntegral() {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    @Override
    public String asText() {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return asText();
    }
}
