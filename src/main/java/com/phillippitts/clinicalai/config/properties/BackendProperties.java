package com.phillippitts.clinicalai.config.properties;

import com.phillippitts.clinicalai.config.pipeline.BackendTopology;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed backend topology selection.
 */
@Validated
@ConfigurationProperties(prefix = "clinical-ai.backend")
public class BackendProperties {

    @NotNull
    private final BackendTopology topology;

    @ConstructorBinding
    public BackendProperties(BackendTopology topology) {
        this.topology = topology == null ? BackendTopology.LOCAL_ONLY : topology;
    }

    public BackendTopology getTopology() {
        return topology;
    }
}
