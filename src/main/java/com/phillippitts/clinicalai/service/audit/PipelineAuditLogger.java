package com.phillippitts.clinicalai.service.audit;

import com.phillippitts.clinicalai.domain.PipelineResult;
import com.phillippitts.clinicalai.domain.PipelineStep;
import com.phillippitts.clinicalai.service.orchestration.event.PipelineCompletedEvent;
import com.phillippitts.clinicalai.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * One-way audit sink for pipeline traces.
 *
 * <p>Writes one line per run and one per step to the {@code clinicalai.audit} logger. Lines are
 * key=value pairs with no clinical text; error summaries are truncated.
 */
@Component
public class PipelineAuditLogger {

    static final String AUDIT_LOGGER_NAME = "clinicalai.audit";
    private static final Logger AUDIT = LogManager.getLogger(AUDIT_LOGGER_NAME);
    private static final int MAX_ERROR_CHARS = 160;

    @EventListener
    public void onPipelineCompleted(PipelineCompletedEvent event) {
        PipelineResult result = event.result();
        AUDIT.info(formatRun(result, event.organizationId()));
        for (PipelineStep step : result.steps()) {
            AUDIT.info(formatStep(result.pipelineId(), step));
        }
    }

    static String formatRun(PipelineResult result, String organizationId) {
        return "pipeline id=" + result.pipelineId()
                + " org=" + LogSanitizer.mask(organizationId)
                + " halted=" + result.halted()
                + " timedOut=" + result.timedOut()
                + " risk=" + result.safety().riskLevel()
                + " safetySource=" + result.safety().source()
                + " assessments=" + result.assessments().keySet()
                + " synthesis=" + result.synthesisText().isPresent()
                + " steps=" + result.steps().size()
                + " durationMs=" + result.totalDurationMs();
    }

    static String formatStep(String pipelineId, PipelineStep step) {
        StringBuilder sb = new StringBuilder("step id=").append(pipelineId)
                .append(" name=").append(step.name().label())
                .append(" status=").append(step.status())
                .append(" durationMs=").append(step.durationMs());
        if (step.isCompleted()) {
            sb.append(" backend=").append(step.backendName());
        } else {
            sb.append(" error=\"").append(LogSanitizer.truncate(step.error(), MAX_ERROR_CHARS)).append('"');
        }
        return sb.toString();
    }
}
