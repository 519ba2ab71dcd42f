package com.phillippitts.clinicalai.service.orchestration;

import com.phillippitts.clinicalai.domain.RiskLevel;
import com.phillippitts.clinicalai.domain.SafetyAssessment;

import java.util.List;

/**
 * What to assume about safety when the screening call itself fails.
 */
public enum SafetyFailurePolicy {

    /** Proceed with an UNKNOWN risk level and no flags. */
    FAIL_OPEN {
        @Override
        public SafetyAssessment substitute() {
            return SafetyAssessment.of(RiskLevel.UNKNOWN, List.of(), "", SafetyAssessment.Source.SUBSTITUTE);
        }
    },

    /** Proceed, but report HIGH risk so the result recommends referral. */
    FAIL_CLOSED {
        @Override
        public SafetyAssessment substitute() {
            return SafetyAssessment.of(RiskLevel.HIGH, List.of(SCREENING_UNAVAILABLE), "",
                    SafetyAssessment.Source.SUBSTITUTE);
        }
    };

    public static final String SCREENING_UNAVAILABLE = "safety screening unavailable";

    public abstract SafetyAssessment substitute();
}
