package com.kotsin.weather.forecast;

import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.domain.model.ValidationMetric;
import com.kotsin.weather.support.SeriesFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.kotsin.weather.support.SeriesFixtures.TEMPERATURE;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrossValidator - rolling-origin validation")
class CrossValidatorTest {

    private ThreadPoolTaskExecutor executor;
    private CrossValidator validator;
    private final ForecastModelFactory factory = new ForecastModelFactory();

    @BeforeEach
    void setUp() {
        executor = SeriesFixtures.executor("cv-test", 4);
        validator = new CrossValidator(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static ModelConfig config(ModelVariant variant, int period) {
        return ModelConfig.builder()
                .variant(variant)
                .seasonalPeriods(Set.of(period))
                .horizon(7)
                .build();
    }

    // ========== Fold Tests ==========

    @Test
    @DisplayName("Every fold that fits inside the series is evaluated out of sample")
    void testRollingOriginFolds() {
        TimeSeries series = SeriesFixtures.series("cv", SeriesFixtures.seasonal(120, 21L, 0.3));
        ModelConfig config = config(ModelVariant.AUTOREGRESSIVE, 7);
        ForecastModel model = factory.create(ModelVariant.AUTOREGRESSIVE);
        FittedModel full = model.fit(series, TEMPERATURE, config);

        ValidationMetric metric = validator.validate(model, series, TEMPERATURE, config, 3, full, full.predict(7));

        assertEquals(3, metric.getFolds());
        assertFalse(metric.isInSample());
        assertEquals(ModelVariant.AUTOREGRESSIVE, metric.getVariant());
        assertTrue(metric.getMae() > 0.0 && Double.isFinite(metric.getMae()));
        assertTrue(metric.getRmse() >= metric.getMae());
        assertTrue(metric.getMeanIntervalWidth() > 0.0);
    }

    @Test
    @DisplayName("Folds whose training window is below the model minimum are skipped")
    void testSkipsShortFolds() {
        TimeSeries series = SeriesFixtures.series("cv", SeriesFixtures.seasonal(40, 22L, 0.3));
        ModelConfig config = config(ModelVariant.SEASONAL_DECOMPOSITION, 7);
        ForecastModel model = factory.create(ModelVariant.SEASONAL_DECOMPOSITION);
        FittedModel full = model.fit(series, TEMPERATURE, config);

        // origins 5, 12, 19, 26, 33 against a minimum of 14
        ValidationMetric metric = validator.validate(model, series, TEMPERATURE, config, 5, full, full.predict(7));

        assertEquals(3, metric.getFolds());
    }

    @Test
    @DisplayName("No usable fold falls back to in-sample errors")
    void testInSampleFallback() {
        TimeSeries series = SeriesFixtures.series("cv", SeriesFixtures.seasonal(14, 23L, 0.3));
        ModelConfig config = config(ModelVariant.AUTOREGRESSIVE, 7);
        ForecastModel model = factory.create(ModelVariant.AUTOREGRESSIVE);
        FittedModel full = model.fit(series, TEMPERATURE, config);

        // single origin at 7 against a minimum of 8
        ValidationMetric metric = validator.validate(model, series, TEMPERATURE, config, 1, full, full.predict(7));

        assertTrue(metric.isInSample());
        assertEquals(0, metric.getFolds());
        assertTrue(Double.isFinite(metric.getMae()));
    }

    @Test
    @DisplayName("A common minimum origin drops folds the adapter alone could have used")
    void testCommonMinimumOrigin() {
        TimeSeries series = SeriesFixtures.series("cv", SeriesFixtures.seasonal(120, 24L, 0.3));
        ModelConfig config = config(ModelVariant.AUTOREGRESSIVE, 7);
        ForecastModel model = factory.create(ModelVariant.AUTOREGRESSIVE);
        FittedModel full = model.fit(series, TEMPERATURE, config);

        // origins 99, 106, 113
        ValidationMetric partial = validator.validate(model, series, TEMPERATURE, config, 3, 106, full,
                full.predict(7));
        ValidationMetric none = validator.validate(model, series, TEMPERATURE, config, 3, 114, full,
                full.predict(7));

        assertEquals(2, partial.getFolds());
        assertFalse(partial.isInSample());
        assertTrue(none.isInSample());
        assertEquals(0, none.getFolds());
    }

    @Test
    @DisplayName("Failed folds are counted and an all-failed run falls back to in-sample errors")
    void testFailedFoldsCounted() {
        TimeSeries series = SeriesFixtures.series("cv", SeriesFixtures.seasonal(120, 25L, 0.3));
        ModelConfig config = config(ModelVariant.AUTOREGRESSIVE, 7);
        ForecastModel model = ForecastModelStubs.failingOnFolds(ModelVariant.AUTOREGRESSIVE, 120);
        FittedModel full = model.fit(series, TEMPERATURE, config);

        ValidationMetric metric = validator.validate(model, series, TEMPERATURE, config, 3, full, full.predict(7));

        assertTrue(metric.isInSample());
        assertEquals(0, metric.getFolds());
        assertEquals(3, metric.getFailedFolds());
        assertTrue(Double.isFinite(metric.getMae()));
    }

    // ========== Ranking Tests ==========

    @Test
    @DisplayName("Ranking orders by error, then by interval width")
    void testRanking() {
        ValidationMetric a = ValidationMetric.builder().variant(ModelVariant.AUTOREGRESSIVE).mae(2.0).meanIntervalWidth(1.0).build();
        ValidationMetric b = ValidationMetric.builder().variant(ModelVariant.TREND_HOLIDAY).mae(1.0).meanIntervalWidth(5.0).build();
        ValidationMetric c = ValidationMetric.builder().variant(ModelVariant.SEQUENCE_LEARNING).mae(1.0).meanIntervalWidth(3.0).build();

        List<ValidationMetric> ranked = new ArrayList<>(List.of(a, b, c));
        ranked.sort(CrossValidator.RANKING);

        assertEquals(ModelVariant.SEQUENCE_LEARNING, ranked.get(0).getVariant());
        assertEquals(ModelVariant.TREND_HOLIDAY, ranked.get(1).getVariant());
        assertEquals(ModelVariant.AUTOREGRESSIVE, ranked.get(2).getVariant());
    }
}
