package com.kotsin.weather.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ForecastResult - contiguous dated intervals")
class ForecastResultTest {

    private static final LocalDate LAST = LocalDate.of(2024, 1, 31);

    @Test
    @DisplayName("fromHalfWidths starts the day after the last observation")
    void testFromHalfWidths() {
        ForecastResult result = ForecastResult.fromHalfWidths("autoregressive", LAST,
                new double[]{1.0, 2.0, 3.0}, new double[]{0.5, 1.0, 1.5});

        assertEquals(3, result.horizon());
        assertEquals(LocalDate.of(2024, 2, 1), result.firstDate());
        assertEquals(LocalDate.of(2024, 2, 3), result.getPoints().get(2).getDate());
        assertEquals(2.0, result.meanIntervalWidth(), 1e-12);
        for (ForecastPoint p : result.getPoints()) {
            assertTrue(p.getLower() <= p.getPoint() && p.getPoint() <= p.getUpper());
        }
    }

    @Test
    @DisplayName("A point outside its interval is rejected")
    void testPointOutsideInterval() {
        assertThrows(IllegalArgumentException.class, () -> new ForecastPoint(LAST, 5.0, 0.0, 4.0));
    }

    @Test
    @DisplayName("Non-contiguous dates are rejected")
    void testNonContiguousDates() {
        List<ForecastPoint> points = List.of(
                new ForecastPoint(LAST.plusDays(1), 1.0, 0.0, 2.0),
                new ForecastPoint(LAST.plusDays(3), 1.0, 0.0, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new ForecastResult("x", points));
    }

    @Test
    @DisplayName("Alert level follows fused severity")
    void testAlertLevel() {
        assertEquals(AlertLevel.HIGH, AlertLevel.fromSeverity(0.85));
        assertEquals(AlertLevel.MEDIUM, AlertLevel.fromSeverity(0.5));
        assertEquals(AlertLevel.LOW, AlertLevel.fromSeverity(0.3));
    }
}
