package com.phillippitts.clinicalai.service.budget;

import java.time.Instant;

/**
 * Point-in-time view of one organization's spend window. Amounts in micro-dollars.
 */
public record BudgetSnapshot(
        String organizationId,
        long spentMicros,
        long ceilingMicros,
        Instant windowStart,
        Instant windowEnd,
        boolean suspended
) {
    public double spentUsd() {
        return spentMicros / (double) CostCalculator.MICROS_PER_DOLLAR;
    }

    public double ceilingUsd() {
        return ceilingMicros / (double) CostCalculator.MICROS_PER_DOLLAR;
    }

    public long remainingMicros() {
        return Math.max(0, ceilingMicros - spentMicros);
    }
}
