package com.quantops.engine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Closing a scope removes everything it set, trace id included")
    void testCloseRemovesScopeKeys() {
        try (var ctx = LoggingContext.forOperation("op-1", "TRAINING", "op-parent")) {
            assertThat(MDC.get(LoggingContext.OPERATION_ID)).isEqualTo("op-1");
            assertThat(MDC.get(LoggingContext.OPERATION_TYPE)).isEqualTo("TRAINING");
            assertThat(MDC.get(LoggingContext.PARENT_OPERATION_ID)).isEqualTo("op-parent");
            assertThat(MDC.get(LoggingContext.TRACE_ID)).isNotBlank();
        }

        assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
    }

    @Test
    @DisplayName("Successive scopes on the same thread get distinct trace ids")
    void testSuccessiveScopesGetOwnTraceId() {
        String first;
        try (var ctx = LoggingContext.forOperation("op-1")) {
            first = MDC.get(LoggingContext.TRACE_ID);
        }
        String second;
        try (var ctx = LoggingContext.forWorker("worker-1")) {
            second = MDC.get(LoggingContext.TRACE_ID);
        }

        assertThat(first).isNotNull();
        assertThat(second).isNotNull().isNotEqualTo(first);
    }

    @Test
    @DisplayName("A nested scope shares the outer trace id and restores the outer values on close")
    void testNestedScopeRestoresOuter() {
        try (var outer = LoggingContext.forOperation("op-outer")) {
            String trace = MDC.get(LoggingContext.TRACE_ID);

            try (var inner = LoggingContext.forOperation("op-inner", "BACKTEST", null)) {
                assertThat(MDC.get(LoggingContext.OPERATION_ID)).isEqualTo("op-inner");
                assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo(trace);
            }

            assertThat(MDC.get(LoggingContext.OPERATION_ID)).isEqualTo("op-outer");
            assertThat(MDC.get(LoggingContext.OPERATION_TYPE)).isNull();
            assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo(trace);
        }

        assertThat(MDC.get(LoggingContext.TRACE_ID)).isNull();
    }

    @Test
    @DisplayName("A trace id already bound by the caller survives the scope")
    void testExternalTraceIdKept() {
        MDC.put(LoggingContext.TRACE_ID, "request1");

        try (var ctx = LoggingContext.forOperation("op-1")) {
            assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo("request1");
        }

        assertThat(MDC.get(LoggingContext.TRACE_ID)).isEqualTo("request1");
        assertThat(MDC.get(LoggingContext.OPERATION_ID)).isNull();
    }
}
