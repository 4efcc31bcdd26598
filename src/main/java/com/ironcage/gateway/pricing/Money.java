package com.ironcage.gateway.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between USD amounts and the micro-dollar longs used by the ledger.
 */
public final class Money {

    public static final long MICROS_PER_USD = 1_000_000L;

    private Money() {
    }

    public static long usdToMicros(BigDecimal usd) {
        return usd.movePointRight(6).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public static long usdToMicros(double usd) {
        return usdToMicros(BigDecimal.valueOf(usd));
    }

    public static BigDecimal toUsd(long micros) {
        return BigDecimal.valueOf(micros, 6);
    }
}
