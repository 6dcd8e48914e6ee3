package com.cluster.state.logging;

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
    @DisplayName("forTransaction should set txnId and txnOperation in MDC")
    void forTransactionSetsMDC() {
        try (LogContext ctx = LogContext.forTransaction("add unit wordpress/0")) {
            assertNotNull(MDC.get("txnId"));
            assertEquals("add unit wordpress/0", MDC.get("txnOperation"));
        }
    }

    @Test
    @DisplayName("forAssignment should set unit and assignmentPolicy in MDC")
    void forAssignmentSetsMDC() {
        try (LogContext ctx = LogContext.forAssignment("wordpress/0", "CLEAN")) {
            assertEquals("wordpress/0", MDC.get("unit"));
            assertEquals("CLEAN", MDC.get("assignmentPolicy"));
        }
    }

    @Test
    @DisplayName("forCleanup should support extra keys")
    void forCleanupWithExtraKeys() {
        try (LogContext ctx = LogContext.forCleanup("c-1").with("cleanupKind", "DYING_UNIT")) {
            assertEquals("c-1", MDC.get("cleanupId"));
            assertEquals("DYING_UNIT", MDC.get("cleanupKind"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forCleanup("c-1").with("cleanupKind", "DYING_MACHINE");

        ctx.close();

        assertNull(MDC.get("cleanupId"));
        assertNull(MDC.get("cleanupKind"));
    }

    @Test
    @DisplayName("Closing should leave unrelated MDC entries alone")
    void unrelatedEntriesKept() {
        MDC.put("requestId", "r-9");

        try (LogContext ctx = LogContext.forTransaction("destroy machine 0")) {
            assertEquals("r-9", MDC.get("requestId"));
        }

        assertEquals("r-9", MDC.get("requestId"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique IDs")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
