package com.phillippitts.clinicalai.service.budget;

import com.phillippitts.clinicalai.domain.GenerationResult;
import com.phillippitts.clinicalai.domain.TokenUsage;

import java.time.Instant;
import java.util.Objects;

/**
 * Token usage of one completed metered call, attributed to an organization.
 */
public record UsageRecord(
        String organizationId,
        String backendName,
        String model,
        TokenUsage usage,
        Instant recordedAt
) {
    public UsageRecord {
        Objects.requireNonNull(backendName, "backendName");
        usage = usage == null ? TokenUsage.NONE : usage;
        recordedAt = recordedAt == null ? Instant.now() : recordedAt;
    }

    public static UsageRecord from(String organizationId, GenerationResult result) {
        return new UsageRecord(organizationId, result.backendName(), result.model(), result.usage(), Instant.now());
    }
}
