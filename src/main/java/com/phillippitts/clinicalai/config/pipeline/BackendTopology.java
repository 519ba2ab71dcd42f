package com.phillippitts.clinicalai.config.pipeline;

/**
 * Which backends serve the pipeline, and in which order.
 */
public enum BackendTopology {
    LOCAL_ONLY(Tier.LOCAL, null),
    LOCAL_WITH_METERED_FALLBACK(Tier.LOCAL, Tier.METERED),
    METERED_WITH_LOCAL_FALLBACK(Tier.METERED, Tier.LOCAL),
    METERED_ONLY(Tier.METERED, null);

    public enum Tier { LOCAL, METERED }

    private final Tier primary;
    private final Tier secondary;

    BackendTopology(Tier primary, Tier secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    public Tier primary() {
        return primary;
    }

    /** @return fallback tier, or null when the topology has a single backend */
    public Tier secondary() {
        return secondary;
    }

    public boolean usesMetered() {
        return primary == Tier.METERED || secondary == Tier.METERED;
    }
}
