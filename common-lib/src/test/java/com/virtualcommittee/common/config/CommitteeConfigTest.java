package com.virtualcommittee.common.config;

import com.virtualcommittee.common.exception.CommitteeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommitteeConfigTest {

    @Test
    @DisplayName("defaults: 500 capital, 5x → 10 risk budget, 2500 capacity")
    void defaults() {
        CommitteeConfig config = CommitteeConfig.defaults();
        assertEquals(500.0, config.capital());
        assertEquals(5, config.leverage());
        assertEquals(10.0, config.maxRiskAmount(), 1e-9);
        assertEquals(2500.0, config.exposureCapacity(), 1e-9);
    }

    @Test
    @DisplayName("non-positive or NaN capital is rejected")
    void rejectsBadCapital() {
        assertThrows(CommitteeException.class, () -> CommitteeConfig.of(0.0, 5));
        assertThrows(CommitteeException.class, () -> CommitteeConfig.of(-100.0, 5));
        assertThrows(CommitteeException.class, () -> CommitteeConfig.of(Double.NaN, 5));
    }

    @Test
    @DisplayName("leverage below 1 is rejected, with the component in the message")
    void rejectsBadLeverage() {
        CommitteeException e = assertThrows(CommitteeException.class, () -> CommitteeConfig.of(500.0, 0));
        assertEquals("CommitteeConfig", e.getComponent());
        assertTrue(e.getMessage().startsWith("[CommitteeConfig]"));
    }

    @Test
    @DisplayName("with() overrides only non-null values")
    void withOverrides() {
        CommitteeConfig base = CommitteeConfig.defaults();
        assertEquals(CommitteeConfig.of(1000.0, 5), base.with(1000.0, null));
        assertEquals(CommitteeConfig.of(500.0, 2), base.with(null, 2));
        assertEquals(base, base.with(null, null));
    }

    @Test
    @DisplayName("screening volume tier follows market cap")
    void screeningVolumeTiers() {
        ScreeningCriteria criteria = ScreeningCriteria.defaults();
        assertEquals(1_000_000d, criteria.minVolumeFor(500_000_000d));
        assertEquals(750_000d, criteria.minVolumeFor(1_000_000_000d));
        assertEquals(750_000d, criteria.minVolumeFor(9_999_999_999d));
        assertEquals(500_000d, criteria.minVolumeFor(10_000_000_000d));
    }
}
