package com.kotsin.weather.quality;

import com.kotsin.weather.config.WeatherInsightProperties;
import com.kotsin.weather.domain.model.ImputationMethod;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.QualityGrade;
import com.kotsin.weather.domain.model.QualityReport;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.forecast.ForecastModelFactory;
import com.kotsin.weather.support.SeriesFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.kotsin.weather.support.SeriesFixtures.TEMPERATURE;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataQualityAssessor - quality scoring and cleaning")
class DataQualityAssessorTest {

    private DataQualityAssessor assessor;
    private List<ModelConfig> models;

    @BeforeEach
    void setUp() {
        assessor = new DataQualityAssessor(new WeatherInsightProperties(), new ForecastModelFactory());
        models = List.of(ModelConfig.builder()
                .variant(ModelVariant.AUTOREGRESSIVE)
                .seasonalPeriods(Set.of(7))
                .horizon(7)
                .build());
    }

    // ========== Scoring Tests ==========

    @Test
    @DisplayName("A complete plausible series scores high")
    void testCleanSeries() {
        TimeSeries series = SeriesFixtures.series("clean", SeriesFixtures.stable(60, 3L, 12.0));

        QualityAssessment assessment = assessor.assess(series, models, null);
        QualityReport report = assessment.getReport();

        assertEquals(1.0, report.getCompleteness(), 1e-12);
        assertEquals(1.0, report.getAccuracy(), 1e-12);
        assertEquals(1.0, report.getTimeliness(), 1e-12);
        assertEquals(QualityGrade.HIGH, report.getGrade());
        assertTrue(report.getTreatments().isEmpty());
        assertEquals(60, report.getSummaries().get(TEMPERATURE).getCount());
    }

    @Test
    @DisplayName("Physically implausible values are treated as missing and imputed")
    void testImplausibleValue() {
        double[] values = SeriesFixtures.stable(60, 4L, 12.0);
        values[30] = 120.0;
        TimeSeries series = SeriesFixtures.series("hot", values);

        QualityAssessment assessment = assessor.assess(series, models, null);

        assertTrue(assessment.getReport().getAccuracy() < 1.0);
        assertFalse(assessment.getReport().getRecommendations().isEmpty());
        double cleaned = assessment.getCleaned().values(TEMPERATURE)[30];
        assertTrue(cleaned < 60.0);
        assertEquals(120.0, series.values(TEMPERATURE)[30], 1e-12);
    }

    @Test
    @DisplayName("Long gaps stay missing in the cleaned copy but not in the model input")
    void testLongGap() {
        double[] values = SeriesFixtures.stable(90, 5L, 12.0);
        Arrays.fill(values, 30, 50, Double.NaN);
        TimeSeries series = SeriesFixtures.series("gap", values);

        QualityAssessment assessment = assessor.assess(series, models, null);

        assertTrue(assessment.getReport().getCompleteness() < 1.0);
        assertTrue(assessment.getReport().getTreatments().stream()
                .anyMatch(g -> g.getMethod() == ImputationMethod.LEFT_MISSING));
        assertEquals(20, assessment.getCleaned().missingCount(TEMPERATURE));
        assertEquals(0, assessment.getModelInput().missingCount(TEMPERATURE));
    }

    @Test
    @DisplayName("Stale series lose timeliness")
    void testStaleSeries() {
        TimeSeries series = SeriesFixtures.series("stale", SeriesFixtures.stable(30, 6L, 12.0));

        QualityReport report = assessor.assess(series, models, series.lastDate().plusDays(16)).getReport();

        assertTrue(report.getTimeliness() < 1.0);
        assertTrue(report.getTimeliness() > 0.0);
    }

    // ========== Length Tests ==========

    @Test
    @DisplayName("Series shorter than every configured model is rejected")
    void testTooShort() {
        TimeSeries series = SeriesFixtures.series("short", SeriesFixtures.stable(5, 7L, 12.0));

        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> assessor.assess(series, models, null));
        assertEquals(5, e.getAvailable());
        assertEquals(8, e.getRequired());
    }
}
