package com.phillippitts.clinicalai.service.budget;

import com.phillippitts.clinicalai.config.properties.BudgetProperties;
import com.phillippitts.clinicalai.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local budget state: one spend window per organization, mutated only by atomic
 * increments.
 *
 * <p>Windows are aligned to multiples of the configured length since the epoch, so a one-day
 * window rolls over at UTC midnight. A window is replaced lazily the first time it is touched
 * after its end.
 */
public class InMemoryBudgetController implements BudgetController {

    private static final Logger LOG = LogManager.getLogger(InMemoryBudgetController.class);

    private final BudgetProperties properties;
    private final CostCalculator costCalculator;
    private final Clock clock;
    private final Map<String, SpendWindow> windows = new ConcurrentHashMap<>();

    public InMemoryBudgetController(BudgetProperties properties, CostCalculator costCalculator, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.costCalculator = Objects.requireNonNull(costCalculator, "costCalculator");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (properties.getWindow().isZero() || properties.getWindow().isNegative()) {
            throw new IllegalArgumentException("Budget window must be positive");
        }
    }

    @Override
    public BudgetDecision canSpend(String organizationId) {
        String org = resolve(organizationId);
        if (properties.getSuspendedOrganizations().contains(org)) {
            return BudgetDecision.deny(BudgetDecision.DenyReason.ORGANIZATION_SUSPENDED);
        }
        SpendWindow window = peek(org);
        long spent = window == null ? 0 : window.spent.get();
        if (spent < ceilingMicros(org)) {
            return BudgetDecision.allow();
        }
        return BudgetDecision.deny(BudgetDecision.DenyReason.CEILING_EXCEEDED);
    }

    @Override
    public void recordUsage(UsageRecord record) {
        Objects.requireNonNull(record, "record");
        String org = resolve(record.organizationId());
        long cost = costCalculator.costMicros(record.usage());
        long total = current(org).spent.addAndGet(cost);
        LOG.debug("Recorded {} micro-dollars for organization {} (window total {})",
                cost, LogSanitizer.mask(org), total);
    }

    @Override
    public BudgetSnapshot snapshot(String organizationId) {
        String org = resolve(organizationId);
        SpendWindow window = current(org);
        return new BudgetSnapshot(org, window.spent.get(), ceilingMicros(org), window.start, window.end,
                properties.getSuspendedOrganizations().contains(org));
    }

    private String resolve(String organizationId) {
        return organizationId == null || organizationId.isBlank()
                ? properties.getDefaultOrganization()
                : organizationId;
    }

    private long ceilingMicros(String org) {
        return CostCalculator.toMicros(properties.ceilingFor(org));
    }

    /** Current window without creating one; expired windows read as empty. */
    private SpendWindow peek(String org) {
        SpendWindow window = windows.get(org);
        if (window == null || !clock.instant().isBefore(window.end)) {
            return null;
        }
        return window;
    }

    private SpendWindow current(String org) {
        Instant now = clock.instant();
        return windows.compute(org, (key, existing) ->
                existing == null || !now.isBefore(existing.end) ? newWindow(now) : existing);
    }

    private SpendWindow newWindow(Instant now) {
        Duration length = properties.getWindow();
        long lengthMillis = length.toMillis();
        long startMillis = Math.floorDiv(now.toEpochMilli(), lengthMillis) * lengthMillis;
        Instant start = Instant.ofEpochMilli(startMillis);
        return new SpendWindow(start, start.plus(length));
    }

    private static final class SpendWindow {
        private final Instant start;
        private final Instant end;
        private final AtomicLong spent = new AtomicLong();

        private SpendWindow(Instant start, Instant end) {
            this.start = start;
            this.end = end;
        }
    }
}
