package com.phillippitts.clinicalai.exception;

/**
 * Thrown when admission control denies a metered call and no unmetered fallback exists.
 */
public class BudgetExceededException extends ClinicalAiException {

    private final String organizationId;
    private final String reason;

    public BudgetExceededException(String organizationId, String reason) {
        super("Budget denied for organization " + organizationId + ": " + reason);
        this.organizationId = organizationId;
        this.reason = reason;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getReason() {
        return reason;
    }
}
