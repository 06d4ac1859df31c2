package com.texture.dedup.logging;

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
    @DisplayName("forRefinement should set runId, dimension and operation in MDC")
    void forRefinementSetsMDC() {
        try (LogContext ctx = LogContext.forRefinement("run-1", "general")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("general", MDC.get("dimension"));
            assertEquals("refine", MDC.get("operation"));
        }
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("forPass nests inside a refinement context")
    void forPassNests() {
        try (LogContext run = LogContext.forRefinement("run-2", "alpha")) {
            try (LogContext pass = LogContext.forPass(3)) {
                assertEquals("3", MDC.get("pass"));
                assertEquals("run-2", MDC.get("runId"));
            }
            assertNull(MDC.get("pass"));
            assertEquals("alpha", MDC.get("dimension"));
        }
    }

    @Test
    @DisplayName("forReview should tag the review operation")
    void forReviewSetsMDC() {
        try (LogContext ctx = LogContext.forReview("run-3", "normal")) {
            assertEquals("review", MDC.get("operation"));
            assertEquals("normal", MDC.get("dimension"));
        }
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("generateRunId should produce unique IDs")
    void generateRunIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
