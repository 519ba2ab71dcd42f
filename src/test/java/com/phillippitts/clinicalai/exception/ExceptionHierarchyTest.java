package com.phillippitts.clinicalai.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsExtendClinicalAiException() {
        assertThat(new GenerationFailedException("x", "ollama")).isInstanceOf(ClinicalAiException.class);
        assertThat(new BackendUnavailableException("x", "claude")).isInstanceOf(ClinicalAiException.class);
        assertThat(new BudgetExceededException("org-1", "daily ceiling exceeded"))
                .isInstanceOf(ClinicalAiException.class);
        assertThat(new PipelineException("x", "p-1", null)).isInstanceOf(ClinicalAiException.class);
        assertThat(new ClinicalAiException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void backendNameIsAppendedToMessage() {
        GenerationFailedException failed = new GenerationFailedException("Bad status", "claude");
        assertThat(failed.getMessage()).isEqualTo("Bad status (backend: claude)");
        assertThat(failed.getBackendName()).isEqualTo("claude");

        BackendUnavailableException unavailable = new BackendUnavailableException("Refused", "ollama");
        assertThat(unavailable.getMessage()).isEqualTo("Refused (backend: ollama)");
        assertThat(unavailable.getBackendName()).isEqualTo("ollama");
    }

    @Test
    void backendNameDefaultsToUnknown() {
        assertThat(new GenerationFailedException("x").getBackendName()).isEqualTo("unknown");
        assertThat(new GenerationFailedException("x", new IOException()).getBackendName()).isEqualTo("unknown");
    }

    @Test
    void causeIsPreserved() {
        IOException io = new IOException("boom");
        assertThat(new GenerationFailedException("x", "ollama", io).getCause()).isSameAs(io);
        assertThat(new BackendUnavailableException("x", "ollama", io).getCause()).isSameAs(io);
        assertThat(new PipelineException("x", "p-1", io).getCause()).isSameAs(io);
    }

    @Test
    void budgetExceededCarriesOrganizationAndReason() {
        BudgetExceededException e = new BudgetExceededException("clinic-7", "organization suspended");
        assertThat(e.getOrganizationId()).isEqualTo("clinic-7");
        assertThat(e.getReason()).isEqualTo("organization suspended");
        assertThat(e.getMessage()).contains("clinic-7").contains("organization suspended");
    }

    @Test
    void pipelineExceptionCarriesPipelineId() {
        PipelineException e = new PipelineException("Pipeline cancelled", "abc-123", null);
        assertThat(e.getPipelineId()).isEqualTo("abc-123");
        assertThat(e.getMessage()).isEqualTo("Pipeline cancelled (pipeline: abc-123)");
    }
}
