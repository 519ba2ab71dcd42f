package com.phillippitts.clinicalai.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadContextTaskDecoratorTest {

    private final ThreadContextTaskDecorator decorator = new ThreadContextTaskDecorator();

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void copiesContextCapturedAtSubmission() throws InterruptedException {
        ThreadContext.put("pipelineId", "p-1");
        ThreadContext.put("organizationId", "org-9");
        AtomicReference<Map<String, String>> seen = new AtomicReference<>();

        Runnable decorated = decorator.decorate(() -> seen.set(new HashMap<>(ThreadContext.getImmutableContext())));
        ThreadContext.clearAll();

        Thread worker = new Thread(decorated);
        worker.start();
        worker.join(5000);

        assertThat(seen.get())
                .containsEntry("pipelineId", "p-1")
                .containsEntry("organizationId", "org-9");
    }

    @Test
    void restoresCallerContextWhenRunInline() {
        ThreadContext.put("pipelineId", "submitted");
        Runnable decorated = decorator.decorate(() -> ThreadContext.put("pipelineId", "changed-inside"));

        ThreadContext.put("pipelineId", "caller");
        decorated.run();

        assertThat(ThreadContext.get("pipelineId")).isEqualTo("caller");
    }

    @Test
    void leavesNoContextBehindOnCleanThread() {
        Runnable decorated = decorator.decorate(() -> ThreadContext.put("organizationId", "leak"));

        decorated.run();

        assertThat(ThreadContext.getImmutableContext()).isEmpty();
    }

    @Test
    void restoresContextWhenTaskThrows() {
        ThreadContext.put("pipelineId", "caller");
        Runnable decorated = decorator.decorate(() -> {
            ThreadContext.put("pipelineId", "inside");
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(decorated::run).isInstanceOf(IllegalStateException.class);
        assertThat(ThreadContext.get("pipelineId")).isEqualTo("caller");
    }
}
