package com.phillippitts.clinicalai.service.budget;

/**
 * Outcome of an admission check.
 *
 * @param allowed    whether the metered call may proceed
 * @param reason     human-readable denial reason, null when allowed
 * @param denyReason structured denial reason, null when allowed
 */
public record BudgetDecision(boolean allowed, String reason, DenyReason denyReason) {

    private static final BudgetDecision ALLOW = new BudgetDecision(true, null, null);

    public enum DenyReason {
        CEILING_EXCEEDED("daily ceiling exceeded"),
        ORGANIZATION_SUSPENDED("organization suspended");

        private final String description;

        DenyReason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    public BudgetDecision {
        if (allowed && denyReason != null) {
            throw new IllegalArgumentException("An allowed decision cannot carry a deny reason");
        }
        if (!allowed && denyReason == null) {
            throw new IllegalArgumentException("A denied decision requires a deny reason");
        }
    }

    public static BudgetDecision allow() {
        return ALLOW;
    }

    public static BudgetDecision deny(DenyReason denyReason) {
        return new BudgetDecision(false, denyReason.description(), denyReason);
    }
}
