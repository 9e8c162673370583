package com.marketgateway.marketdata.params;

import com.marketgateway.common.exception.ValidationException;
import com.marketgateway.marketdata.client.FinnhubResolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UsIntervalTest {

    @Test
    @DisplayName("labels map to provider resolutions")
    void mapsToResolution() {
        assertEquals("1", UsInterval.parse("1m").resolution().code());
        assertEquals("15", UsInterval.parse("15m").resolution().code());
        assertEquals("60", UsInterval.parse("1h").resolution().code());
        assertEquals(FinnhubResolution.DAY, UsInterval.parse("1D").resolution());
    }

    @Test
    @DisplayName("blank input means 1h")
    void blankDefaults() {
        assertSame(UsInterval.H1, UsInterval.parse(null));
        assertSame(UsInterval.H1, UsInterval.parse(" "));
    }

    @Test
    @DisplayName("unknown labels are rejected")
    void unknownRejected() {
        ValidationException e = assertThrows(ValidationException.class, () -> UsInterval.parse("2h"));
        assertTrue(e.getMessage().contains("1m, 5m, 15m, 30m, 1h, 1d"));
    }

    @Test
    @DisplayName("range days: blank defaults to 5, bounds are inclusive")
    void rangeDays() {
        assertEquals(5, RangeDays.parse(null));
        assertEquals(5, RangeDays.parse(""));
        assertEquals(1, RangeDays.parse("1"));
        assertEquals(365, RangeDays.parse(" 365 "));
        assertThrows(ValidationException.class, () -> RangeDays.parse("0"));
        assertThrows(ValidationException.class, () -> RangeDays.parse("366"));
        assertThrows(ValidationException.class, () -> RangeDays.parse("five"));
    }
}
