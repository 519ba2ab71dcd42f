package com.phillippitts.clinicalai.service.fallback;

import com.phillippitts.clinicalai.domain.GenerationRequest;
import com.phillippitts.clinicalai.domain.GenerationResult;
import com.phillippitts.clinicalai.exception.BudgetExceededException;
import com.phillippitts.clinicalai.service.backend.BackendNames;
import com.phillippitts.clinicalai.service.backend.BackendStatus;
import com.phillippitts.clinicalai.service.backend.GenerationBackend;
import com.phillippitts.clinicalai.service.budget.BudgetController;
import com.phillippitts.clinicalai.service.budget.BudgetDecision;
import com.phillippitts.clinicalai.service.budget.UsageRecord;
import com.phillippitts.clinicalai.service.budget.UsageRecorder;
import com.phillippitts.clinicalai.service.fallback.event.AllBackendsFailedEvent;
import com.phillippitts.clinicalai.service.fallback.event.BackendFallbackEvent;
import com.phillippitts.clinicalai.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.clinicalai.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Primary/secondary composition presenting the {@link GenerationBackend} contract.
 *
 * <p>Per call:
 * <ol>
 *   <li>A metered primary must pass {@link BudgetController#canSpend(String)}. When denied the
 *       call goes to the secondary, or fails with {@link BudgetExceededException} if there is none.</li>
 *   <li>On primary success, metered usage is submitted to the {@link UsageRecorder} and the result
 *       returned.</li>
 *   <li>On primary failure without a secondary the primary error is rethrown unchanged. Otherwise
 *       the secondary is tried once (a metered secondary must pass admission too). If it also
 *       fails, the secondary error is logged and the <b>primary</b> error is rethrown.</li>
 * </ol>
 *
 * <p>A call is never split across backends; streaming goes to the primary only.
 * Usage accounting never fails a response.
 */
public class FallbackGenerationBackend implements GenerationBackend {

    private static final Logger LOG = LogManager.getLogger(FallbackGenerationBackend.class);

    private final GenerationBackend primary;
    private final GenerationBackend secondary;
    private final BudgetController budgetController;
    private final UsageRecorder usageRecorder;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetricsPublisher metrics;

    /**
     * @param primary          backend tried first (required)
     * @param secondary        fallback backend (nullable)
     * @param budgetController admission control; required when either backend is metered
     * @param usageRecorder    accounting side channel; required when either backend is metered
     * @param publisher        event publisher (nullable in tests)
     * @param metrics          metrics facade (use {@link PipelineMetricsPublisher#NOOP} in tests)
     */
    public FallbackGenerationBackend(GenerationBackend primary,
                                     GenerationBackend secondary,
                                     BudgetController budgetController,
                                     UsageRecorder usageRecorder,
                                     ApplicationEventPublisher publisher,
                                     PipelineMetricsPublisher metrics) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.secondary = secondary;
        this.budgetController = budgetController;
        this.usageRecorder = usageRecorder;
        this.publisher = publisher;
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
        if (isMetered() && (budgetController == null || usageRecorder == null)) {
            throw new IllegalArgumentException(
                    "A metered backend requires a budget controller and a usage recorder");
        }
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String org = request.organizationId();

        BudgetDecision admission = admit(primary, org);
        if (!admission.allowed()) {
            if (secondary == null) {
                throw new BudgetExceededException(org, admission.reason());
            }
            fallback("budget denied: " + admission.reason());
            return generateOn(secondary, request);
        }

        GenerationResult result;
        try {
            result = primary.generate(request);
        } catch (RuntimeException primaryError) {
            if (secondary == null) {
                throw primaryError;
            }
            return recoverWithSecondary(request, primaryError);
        }
        account(primary, org, result);
        return result;
    }

    @Override
    public GenerationResult generateStream(GenerationRequest request, Consumer<String> onChunk) {
        Objects.requireNonNull(request, "request must not be null");
        String org = request.organizationId();
        BudgetDecision admission = admit(primary, org);
        if (!admission.allowed()) {
            throw new BudgetExceededException(org, admission.reason());
        }
        GenerationResult result = primary.generateStream(request, onChunk);
        account(primary, org, result);
        return result;
    }

    private GenerationResult recoverWithSecondary(GenerationRequest request, RuntimeException primaryError) {
        String org = request.organizationId();
        fallback(primaryError.getClass().getSimpleName());
        LOG.warn("Primary backend {} failed: {}", primary.getBackendName(), primaryError.getMessage());

        BudgetDecision admission = admit(secondary, org);
        if (!admission.allowed()) {
            allFailed("secondary denied by budget: " + admission.reason());
            throw primaryError;
        }
        GenerationResult result;
        try {
            result = secondary.generate(request);
        } catch (RuntimeException secondaryError) {
            LOG.error("Secondary backend {} also failed: {}", secondary.getBackendName(),
                    secondaryError.getMessage());
            allFailed(secondaryError.getClass().getSimpleName());
            throw primaryError;
        }
        account(secondary, org, result);
        return result;
    }

    /** Budget-denied primary: the secondary is the only candidate, so its error is the one reported. */
    private GenerationResult generateOn(GenerationBackend backend, GenerationRequest request) {
        String org = request.organizationId();
        BudgetDecision admission = admit(backend, org);
        if (!admission.allowed()) {
            allFailed("budget denied: " + admission.reason());
            throw new BudgetExceededException(org, admission.reason());
        }
        GenerationResult result;
        try {
            result = backend.generate(request);
        } catch (RuntimeException e) {
            allFailed(e.getClass().getSimpleName());
            throw e;
        }
        account(backend, org, result);
        return result;
    }

    private BudgetDecision admit(GenerationBackend backend, String org) {
        if (!backend.isMetered()) {
            return BudgetDecision.allow();
        }
        BudgetDecision decision = budgetController.canSpend(org);
        if (!decision.allowed()) {
            LOG.info("Metered call to {} denied for organization {}: {}",
                    backend.getBackendName(), LogSanitizer.mask(org), decision.reason());
            metrics.recordBudgetDenial(decision.denyReason().name());
        }
        return decision;
    }

    private void account(GenerationBackend backend, String org, GenerationResult result) {
        if (!backend.isMetered()) {
            return;
        }
        try {
            usageRecorder.submit(UsageRecord.from(org, result));
        } catch (RuntimeException e) {
            LOG.error("Usage accounting submit failed for {}: {}", backend.getBackendName(), e.getMessage(), e);
        }
    }

    private void fallback(String reason) {
        metrics.recordFallback(primary.getBackendName(), secondary.getBackendName());
        if (publisher != null) {
            publisher.publishEvent(new BackendFallbackEvent(primary.getBackendName(),
                    secondary.getBackendName(), reason, Instant.now()));
        }
    }

    private void allFailed(String reason) {
        if (publisher != null) {
            publisher.publishEvent(new AllBackendsFailedEvent(primary.getBackendName(),
                    secondary == null ? null : secondary.getBackendName(), reason, Instant.now()));
        }
    }

    @Override
    public boolean isAvailable() {
        return primary.isAvailable() || (secondary != null && secondary.isAvailable());
    }

    @Override
    public BackendStatus getStatus() {
        List<BackendStatus> members = new ArrayList<>();
        members.add(primary.getStatus());
        if (secondary != null) {
            members.add(secondary.getStatus());
        }
        boolean available = members.stream().anyMatch(BackendStatus::available);
        return new BackendStatus(getBackendName(), available, isMetered(), members.get(0).model(),
                null, List.of(), members);
    }

    @Override
    public String getBackendName() {
        return BackendNames.composite(primary.getBackendName(),
                secondary == null ? null : secondary.getBackendName());
    }

    @Override
    public boolean isMetered() {
        return primary.isMetered() || (secondary != null && secondary.isMetered());
    }

    public GenerationBackend primary() {
        return primary;
    }

    public GenerationBackend secondary() {
        return secondary;
    }
}
