package com.phillippitts.clinicalai;

import com.phillippitts.clinicalai.config.backend.ClaudeConfig;
import com.phillippitts.clinicalai.config.backend.OllamaConfig;
import com.phillippitts.clinicalai.config.properties.BackendProperties;
import com.phillippitts.clinicalai.config.properties.BudgetProperties;
import com.phillippitts.clinicalai.config.properties.PipelineProperties;
import com.phillippitts.clinicalai.config.properties.ThreadPoolProperties;
import com.phillippitts.clinicalai.config.properties.WatchdogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        OllamaConfig.class,
        ClaudeConfig.class,
        BackendProperties.class,
        BudgetProperties.class,
        WatchdogProperties.class,
        PipelineProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class ClinicalAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicalAiApplication.class, args);
    }

}
