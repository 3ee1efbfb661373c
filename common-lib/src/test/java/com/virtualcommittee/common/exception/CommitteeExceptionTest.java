package com.virtualcommittee.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommitteeExceptionTest {

    @Test
    @DisplayName("request-wide problem: component prefix, no instrument")
    void requestWide() {
        CommitteeException e = new CommitteeException("CommitteeScanService", "Scan request has no candidates");
        assertEquals("[CommitteeScanService] Scan request has no candidates", e.getMessage());
        assertEquals("CommitteeScanService", e.getComponent());
        assertNull(e.getInstrumentId());
    }

    @Test
    @DisplayName("instrument problem: instrument named in message and kept as a field")
    void forInstrument() {
        CommitteeException e = CommitteeException.forInstrument("CommitteeController", "ABC", "ticker snapshot is required");
        assertEquals("[CommitteeController] ticker snapshot is required (instrument=ABC)", e.getMessage());
        assertEquals("ABC", e.getInstrumentId());
    }
}
