package com.meterly.api.billing.upstream;

import lombok.NonNull;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Set;

/**
 * Converts between decimal amounts and the integer minor units that Stripe uses for money.
 */
public final class MinorUnits {

    // https://stripe.com/docs/currencies#zero-decimal
    private static final Set<String> ZERO_DECIMAL_CURRENCIES = Set.of(
        "bif", "clp", "djf", "gnf", "jpy", "kmf", "krw", "mga",
        "pyg", "rwf", "ugx", "vnd", "vuv", "xaf", "xof", "xpf");

    private MinorUnits() {
    }

    public static int exponent(@NonNull String currency) {
        return ZERO_DECIMAL_CURRENCIES.contains(currency.toLowerCase(Locale.ROOT)) ? 0 : 2;
    }

    /**
     * @return the decimal amount for {@code minor} units, e.g. {@code 7900 usd -> 79.00}. A
     * {@literal null} amount converts to zero.
     */
    @NonNull
    public static BigDecimal toDecimal(Long minor, @NonNull String currency) {
        return BigDecimal.valueOf(minor == null ? 0 : minor, exponent(currency))
            .setScale(2, RoundingMode.UNNECESSARY);
    }

    /**
     * @return the amount in minor units, rounded half-up.
     */
    public static long fromDecimal(@NonNull BigDecimal amount, @NonNull String currency) {
        return amount.setScale(exponent(currency), RoundingMode.HALF_UP)
            .movePointRight(exponent(currency))
            .longValueExact();
    }
}
