package com.phillippitts.clinicalai.service.budget;

import com.phillippitts.clinicalai.domain.TokenUsage;

/**
 * Converts token usage into micro-dollars from per-million-token prices.
 *
 * <p>Cache reads are billed at {@value #CACHE_READ_MULTIPLIER} and cache writes at
 * {@value #CACHE_WRITE_MULTIPLIER} of the input price. With prices quoted per million tokens,
 * one token at price {@code p} costs exactly {@code p} micro-dollars.
 */
public final class CostCalculator {

    public static final long MICROS_PER_DOLLAR = 1_000_000L;
    static final double CACHE_READ_MULTIPLIER = 0.10;
    static final double CACHE_WRITE_MULTIPLIER = 1.25;

    private final double inputPricePerMillion;
    private final double outputPricePerMillion;

    public CostCalculator(double inputPricePerMillion, double outputPricePerMillion) {
        if (inputPricePerMillion < 0 || outputPricePerMillion < 0) {
            throw new IllegalArgumentException("Prices must not be negative");
        }
        this.inputPricePerMillion = inputPricePerMillion;
        this.outputPricePerMillion = outputPricePerMillion;
    }

    public long costMicros(TokenUsage usage) {
        if (usage == null) {
            return 0;
        }
        double micros = usage.inputTokens() * inputPricePerMillion
                + usage.outputTokens() * outputPricePerMillion
                + usage.cacheReadTokens() * inputPricePerMillion * CACHE_READ_MULTIPLIER
                + usage.cacheCreationTokens() * inputPricePerMillion * CACHE_WRITE_MULTIPLIER;
        return Math.round(micros);
    }

    public static long toMicros(double usd) {
        return Math.round(usd * MICROS_PER_DOLLAR);
    }
}
