package com.phillippitts.clinicalai.exception;

import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationExceptionBuilderTest {

    @Test
    void buildsPlainMessageWithoutDetails() {
        GenerationFailedException e = GenerationExceptionBuilder.create("Malformed body")
                .backend("ollama")
                .build();

        assertThat(e.getMessage()).isEqualTo("Malformed body (backend: ollama)");
        assertThat(e.getBackendName()).isEqualTo("ollama");
    }

    @Test
    void appendsStatusDurationAndMetadataInOrder() {
        GenerationFailedException e = GenerationExceptionBuilder.create("Rate limited by backend")
                .backend("claude")
                .statusCode(429)
                .durationMs(812)
                .metadata("model", "claude-sonnet")
                .build();

        assertThat(e.getMessage())
                .isEqualTo("Rate limited by backend (statusCode=429, durationMs=812, model=claude-sonnet) (backend: claude)");
    }

    @Test
    void ignoresNullMetadata() {
        GenerationFailedException e = GenerationExceptionBuilder.create("Failed")
                .metadata(null, "x")
                .metadata("k", null)
                .build();

        assertThat(e.getMessage()).isEqualTo("Failed (backend: unknown)");
    }

    @Test
    void buildUnavailableKeepsCause() {
        ConnectException refused = new ConnectException("Connection refused");
        BackendUnavailableException e = GenerationExceptionBuilder.create("ollama is unreachable")
                .backend("ollama")
                .cause(refused)
                .buildUnavailable();

        assertThat(e.getCause()).isSameAs(refused);
        assertThat(e.getBackendName()).isEqualTo("ollama");
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> GenerationExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GenerationExceptionBuilder.create(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
