package com.catalog.reclassification.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId and operation in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-123")) {
            assertEquals("run-123", MDC.get("runId"));
            assertEquals("reclassify", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forCatalogLoad should set catalogSource and operation in MDC")
    void forCatalogLoadSetsMDC() {
        try (LogContext ctx = LogContext.forCatalogLoad("Alimentação")) {
            assertEquals("Alimentação", MDC.get("catalogSource"));
            assertEquals("catalog-load", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close, including added keys")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forRun("run-123").with("stage", "semantic");
        assertEquals("semantic", MDC.get("stage"));

        ctx.close();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("generateRunId should return unique values")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
