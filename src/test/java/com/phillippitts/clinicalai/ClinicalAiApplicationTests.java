package com.phillippitts.clinicalai;

import com.phillippitts.clinicalai.service.backend.GenerationBackend;
import com.phillippitts.clinicalai.service.orchestration.PipelineOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "clinical-ai.watchdog.enabled=false", // no health checks against a real Ollama during tests
        "clinical-ai.backend.ollama.base-url=http://127.0.0.1:1"
    }
)
class ClinicalAiApplicationTests {

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Autowired
    private GenerationBackend pipelineBackend;

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(pipelineBackend.getBackendName()).isEqualTo("ollama");
    }

}
