package com.phillippitts.clinicalai.domain;

/**
 * Minimal patient context used for prompt formatting only.
 *
 * @param age         age in years, or null when unknown
 * @param displayName name shown in letters (nullable)
 */
public record PatientContext(Integer age, String displayName) {

    public static final PatientContext UNKNOWN = new PatientContext(null, null);

    public PatientContext {
        if (age != null && age < 0) {
            throw new IllegalArgumentException("age must not be negative, got: " + age);
        }
    }

    public String ageLabel() {
        return age == null ? "unknown" : String.valueOf(age);
    }

    public String nameLabel() {
        return displayName == null || displayName.isBlank() ? "the patient" : displayName;
    }
}
