package com.kotsin.weather.domain.validator;

import com.kotsin.weather.domain.model.SeriesPoint;
import com.kotsin.weather.domain.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SeriesSanityValidator - physical and calendar checks")
class SeriesSanityValidatorTest {

    private static final LocalDate START = LocalDate.of(2023, 6, 1);

    // ========== Range Tests ==========

    @Test
    @DisplayName("Known variables are checked against their physical range")
    void testPhysicalRanges() {
        assertTrue(SeriesSanityValidator.isPlausible("temperature", 35.0));
        assertFalse(SeriesSanityValidator.isPlausible("temperature", 75.0));
        assertFalse(SeriesSanityValidator.isPlausible("humidity", 120.0));
        assertFalse(SeriesSanityValidator.isPlausible("precipitation", -1.0));
        assertTrue(SeriesSanityValidator.isPlausible("temperature_max", 40.0));
    }

    @Test
    @DisplayName("Unknown variables only need to be finite")
    void testUnknownVariable() {
        assertTrue(SeriesSanityValidator.isPlausible("load_mw", 1e9));
        assertFalse(SeriesSanityValidator.isPlausible("load_mw", Double.POSITIVE_INFINITY));
        assertNull(SeriesSanityValidator.physicalRange("load_mw"));
    }

    // ========== Calendar Tests ==========

    @Test
    @DisplayName("Calendar gaps are counted between consecutive points")
    void testCalendarGaps() {
        TimeSeries series = TimeSeries.of("s", List.of(
                SeriesPoint.of(START, "temperature", 1.0),
                SeriesPoint.of(START.plusDays(1), "temperature", 1.0),
                SeriesPoint.of(START.plusDays(4), "temperature", 1.0)));

        assertEquals(1, SeriesSanityValidator.countCalendarGaps(series));
        assertFalse(SeriesSanityValidator.validate(series).isEmpty());
    }

    @Test
    @DisplayName("A sudden jump is counted as implausible")
    void testImplausibleJumps() {
        double[] values = new double[40];
        for (int i = 0; i < values.length; i++) {
            values[i] = 10.0 + (i % 2 == 0 ? 0.5 : -0.5);
        }
        values[20] = 60.0;

        // the spike creates two large changes: up and back down
        assertEquals(2, SeriesSanityValidator.countImplausibleJumps(values, 6.0));
    }

    @Test
    @DisplayName("A clean series has no violations")
    void testCleanSeries() {
        TimeSeries series = TimeSeries.daily("s", "temperature", START, new double[]{10, 11, 12, 11, 10});
        assertTrue(SeriesSanityValidator.validate(series).isEmpty());
    }
}
