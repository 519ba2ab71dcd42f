package com.phillippitts.clinicalai.service.budget;

/**
 * Spend-limited admission control for metered backends.
 *
 * <p>{@link #canSpend(String)} is a pure read; {@link #recordUsage(UsageRecord)} is the only
 * mutator. There is no reservation step, so concurrent callers that were all admitted may
 * together overshoot the ceiling by the cost of their in-flight calls.
 */
public interface BudgetController {

    /**
     * Decides whether the organization may start another metered call. No side effects.
     *
     * @param organizationId tenant identifier; null maps to the default organization
     */
    BudgetDecision canSpend(String organizationId);

    /**
     * Adds the cost of a completed metered call to the organization's current window.
     * Not idempotent: the same record twice counts twice. Failures propagate; callers on the
     * response path go through {@link UsageRecorder}, which never lets them escape.
     *
     * @throws NullPointerException if {@code record} is null
     */
    void recordUsage(UsageRecord record);

    /** Current window state for the organization. */
    BudgetSnapshot snapshot(String organizationId);
}
