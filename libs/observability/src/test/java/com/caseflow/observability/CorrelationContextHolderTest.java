package com.caseflow.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge and handoff to
 * other threads.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "case-1", "actor-1", "req-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank correlation id")
        void shouldRejectBlankCorrelationId() {
            assertThatThrownBy(() -> new CorrelationContext(" ", null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "case-1", "actor-1", "req-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("aggregateId")).isEqualTo("case-1");
            assertThat(MDC.get("actorId")).isEqualTo("actor-1");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "case-1", "actor-1", "req-1"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("aggregateId")).isNull();
            assertThat(MDC.get("actorId")).isNull();
            assertThat(MDC.get("requestId")).isNull();
        }

        @Test
        @DisplayName("should remove stale MDC values for null fields")
        void shouldRemoveStaleValues() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "case-1", "actor-1", null));
            CorrelationContextHolder.set(new CorrelationContext("corr-2", null, null, null));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-2");
            assertThat(MDC.get("aggregateId")).isNull();
            assertThat(MDC.get("actorId")).isNull();
        }
    }

    @Nested
    @DisplayName("runWithContext")
    class RunWithContext {

        @Test
        @DisplayName("should restore the previous context even if the runnable throws")
        void shouldRestoreOnException() {
            var outer = new CorrelationContext("outer-corr", null, null, null);
            var inner = new CorrelationContext("inner-corr", null, null, null);
            CorrelationContextHolder.set(outer);

            assertThatThrownBy(
                            () ->
                                    CorrelationContextHolder.runWithContext(
                                            inner,
                                            () -> {
                                                throw new IllegalStateException("boom");
                                            }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("should clear context afterwards when none was set before")
        void shouldClearWhenNoPreviousContext() {
            var ctx = new CorrelationContext("temp-corr", null, null, null);
            AtomicReference<String> seen = new AtomicReference<>();

            CorrelationContextHolder.runWithContext(ctx, () -> seen.set(MDC.get("correlationId")));

            assertThat(seen.get()).isEqualTo("temp-corr");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("thread handoff")
    class ThreadHandoff {

        @Test
        @DisplayName("should not leak context across threads")
        void shouldNotLeakAcrossThreads() throws InterruptedException {
            CorrelationContextHolder.set(new CorrelationContext("main-corr", null, null, null));

            AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
            Thread other = new Thread(() -> otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
            other.start();
            other.join();

            assertThat(otherThreadHasContext.get()).isFalse();
        }

        @Test
        @DisplayName("wrap carries the captured context into an executor thread")
        void wrapCarriesContext() throws Exception {
            CorrelationContextHolder.set(new CorrelationContext("handoff-corr", "case-9", null, null));
            AtomicReference<String> seen = new AtomicReference<>();
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                executor.submit(CorrelationContextHolder.wrap(() -> seen.set(MDC.get("aggregateId")))).get();
                executor.submit(() -> assertThat(CorrelationContextHolder.get()).isEmpty()).get();
            } finally {
                executor.shutdown();
                executor.awaitTermination(5, TimeUnit.SECONDS);
            }

            assertThat(seen.get()).isEqualTo("case-9");
        }
    }
}
