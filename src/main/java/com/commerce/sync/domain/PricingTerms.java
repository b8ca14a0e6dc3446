package com.commerce.sync.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Currency;

/**
 * Exchange rate and margin that turn a source price into the expected target price.
 * <p>
 * {@code expected = (sourcePrice / exchangeRate) * marginMultiplier}, rounded to the target
 * currency's minor unit: two decimals for currencies with subdivision, none for currencies without.
 */
@Value
public class PricingTerms {

    BigDecimal exchangeRate;
    BigDecimal marginMultiplier;
    Currency targetCurrency;

    @Builder
    public PricingTerms(@NonNull BigDecimal exchangeRate, @NonNull BigDecimal marginMultiplier,
                        @NonNull Currency targetCurrency) {
        if (exchangeRate.signum() <= 0) {
            throw new IllegalArgumentException("Exchange rate must be positive: " + exchangeRate);
        }
        if (marginMultiplier.signum() <= 0) {
            throw new IllegalArgumentException("Margin multiplier must be positive: " + marginMultiplier);
        }
        this.exchangeRate = exchangeRate;
        this.marginMultiplier = marginMultiplier;
        this.targetCurrency = targetCurrency;
    }

    /**
     * Unrounded expected target price.
     */
    public BigDecimal expectedTargetPrice(BigDecimal sourcePrice) {
        return sourcePrice.divide(exchangeRate, MathContext.DECIMAL64).multiply(marginMultiplier);
    }

    public BigDecimal roundToMinorUnit(BigDecimal price) {
        return price.setScale(minorUnitDigits(), RoundingMode.HALF_UP);
    }

    public int minorUnitDigits() {
        return targetCurrency.getDefaultFractionDigits() > 0 ? 2 : 0;
    }
}
