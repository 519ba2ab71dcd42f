package com.phillippitts.clinicalai.service.orchestration;

import com.phillippitts.clinicalai.domain.RiskLevel;
import com.phillippitts.clinicalai.domain.SafetyAssessment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class SafetyClassifierTest {

    private final SafetyClassifier classifier = new SafetyClassifier();

    @Test
    void structuredClassificationWins() {
        SafetyAssessment assessment = classifier.classify(
                "{\"riskLevel\": \"LOW\", \"flags\": []}\nNo emergency signs; monitor progress.");

        assertThat(assessment.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(assessment.source()).isEqualTo(SafetyAssessment.Source.STRUCTURED);
        assertThat(assessment.flags()).isEmpty();
    }

    @Test
    void structuredObjectMayBeSurroundedByProse() {
        SafetyAssessment assessment = classifier.classify(
                "Assessment follows. {\"riskLevel\":\"critical\",\"flags\":[\"saddle anaesthesia\",\"urinary retention\"]} "
                        + "Refer today {see notes}.");

        assertThat(assessment.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(assessment.flags()).containsExactly("saddle anaesthesia", "urinary retention");
        assertThat(assessment.mayProceed()).isFalse();
    }

    @Test
    void unknownStructuredLevelFallsBackToKeywords() {
        SafetyAssessment assessment = classifier.classify("{\"riskLevel\":\"severe\"} please refer to a physician");

        assertThat(assessment.source()).isEqualTo(SafetyAssessment.Source.KEYWORD);
        assertThat(assessment.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(assessment.flags()).containsExactly("refer", "physician");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Signs consistent with cauda equina; immediate referral required | CRITICAL",
            "Pasienten trenger akutt henvisning | CRITICAL",
            "Bør henvise til lege for utredning | HIGH",
            "Recommend referral for further investigation | HIGH",
            "Proceed with caution and monitor symptoms | MODERATE",
            "Vær forsiktig | MODERATE",
            "Risk level: CRITICAL - saddle anaesthesia | CRITICAL",
            "Risikonivå: kritisk | CRITICAL",
            "Risk level: HIGH. Suspected fracture. | HIGH",
            "Risk: high | HIGH",
            "Risk: MODERATE | MODERATE",
            "Medium risk, reassess in two weeks | MODERATE",
            "Mechanical low back pain, good prognosis | LOW",
            "Highly localised tenderness, criticality low | LOW"
    })
    void keywordTiers(String text, RiskLevel expected) {
        assertThat(classifier.classify(text).riskLevel()).isEqualTo(expected);
    }

    @Test
    void highestTierDeterminesFlags() {
        SafetyAssessment assessment = classifier.classify("Emergency: refer immediately, monitor closely");

        assertThat(assessment.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(assessment.flags()).containsExactly("emergency");
    }

    @Test
    void tierNameSetsLevelWithoutBecomingFlag() {
        SafetyAssessment assessment = classifier.classify("Risk level: CRITICAL - saddle anaesthesia");

        assertThat(assessment.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(assessment.mayProceed()).isFalse();
        assertThat(assessment.flags()).isEmpty();
    }

    @Test
    void keywordsMatchWholeWordsOnly() {
        assertThat(classifier.classify("The legend shows a preferred monitoring chart").riskLevel())
                .isEqualTo(RiskLevel.LOW);
    }

    @Test
    void emptyTextIsLow() {
        assertThat(classifier.classify(null).riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(classifier.classify("").source()).isEqualTo(SafetyAssessment.Source.KEYWORD);
    }

    @Test
    void substitutesFollowPolicy() {
        SafetyAssessment open = SafetyFailurePolicy.FAIL_OPEN.substitute();
        SafetyAssessment closed = SafetyFailurePolicy.FAIL_CLOSED.substitute();

        assertThat(open.riskLevel()).isEqualTo(RiskLevel.UNKNOWN);
        assertThat(open.mayProceed()).isTrue();
        assertThat(closed.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(closed.flags()).containsExactly(SafetyFailurePolicy.SCREENING_UNAVAILABLE);
        assertThat(closed.isSubstitute()).isTrue();
    }
}
