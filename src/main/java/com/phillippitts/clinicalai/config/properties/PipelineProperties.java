package com.phillippitts.clinicalai.config.properties;

import com.phillippitts.clinicalai.service.orchestration.SafetyFailurePolicy;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pipeline behaviour read once at startup.
 */
@ConfigurationProperties(prefix = "clinical-ai.pipeline")
@Validated
public class PipelineProperties {

    /** Run the synthesis step when more than one assessment succeeded. */
    private boolean synthesisEnabled = true;

    /** Substitute used when the safety screening call fails. */
    @NotNull
    private SafetyFailurePolicy safetyFailurePolicy = SafetyFailurePolicy.FAIL_OPEN;

    /** Default end-to-end timeout for {@code run}, in seconds. */
    @Positive(message = "Timeout seconds must be positive")
    private int timeoutSeconds = 120;

    /** How long a timed-out {@code run} waits for its cancelled work to stop, in milliseconds. */
    @Positive(message = "Cancel grace must be positive")
    private long cancelGraceMs = 5_000;

    public boolean isSynthesisEnabled() {
        return synthesisEnabled;
    }

    public void setSynthesisEnabled(boolean synthesisEnabled) {
        this.synthesisEnabled = synthesisEnabled;
    }

    public SafetyFailurePolicy getSafetyFailurePolicy() {
        return safetyFailurePolicy;
    }

    public void setSafetyFailurePolicy(SafetyFailurePolicy safetyFailurePolicy) {
        this.safetyFailurePolicy = safetyFailurePolicy;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getCancelGraceMs() {
        return cancelGraceMs;
    }

    public void setCancelGraceMs(long cancelGraceMs) {
        this.cancelGraceMs = cancelGraceMs;
    }
}
