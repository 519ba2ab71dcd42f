package com.phillippitts.clinicalai.domain;

/**
 * Fixed vocabulary of pipeline step names recorded in the execution trace.
 */
public enum StepName {
    SAFETY("safety"),
    CLINICAL("clinical"),
    DIFFERENTIAL("differential"),
    LETTER("letter"),
    SYNTHESIS("synthesis");

    private final String label;

    StepName(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
