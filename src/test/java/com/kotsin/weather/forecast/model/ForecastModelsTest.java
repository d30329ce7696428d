package com.kotsin.weather.forecast.model;

import com.kotsin.weather.domain.model.ForecastPoint;
import com.kotsin.weather.domain.model.ForecastResult;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.ModelVariant;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.exception.ModelFitException;
import com.kotsin.weather.forecast.FittedModel;
import com.kotsin.weather.forecast.ForecastModel;
import com.kotsin.weather.forecast.ForecastModelFactory;
import com.kotsin.weather.forecast.PredictionIntervals;
import com.kotsin.weather.support.SeriesFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import static com.kotsin.weather.support.SeriesFixtures.TEMPERATURE;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Forecast models - fit and predict contract")
class ForecastModelsTest {

    private static final int HORIZON = 7;

    private final ForecastModelFactory factory = new ForecastModelFactory();

    private static ModelConfig config(ModelVariant variant) {
        return ModelConfig.builder()
                .variant(variant)
                .seasonalPeriods(Set.of(7))
                .horizon(HORIZON)
                .build();
    }

    private static void assertContract(ForecastResult result, TimeSeries training) {
        assertEquals(HORIZON, result.horizon());
        assertEquals(training.lastDate().plusDays(1), result.firstDate());
        LocalDate expected = training.lastDate().plusDays(1);
        for (ForecastPoint p : result.getPoints()) {
            assertEquals(expected, p.getDate());
            assertTrue(Double.isFinite(p.getPoint()));
            assertTrue(p.getLower() <= p.getPoint() && p.getPoint() <= p.getUpper());
            expected = expected.plusDays(1);
        }
    }

    private FittedModel fit(ModelVariant variant, TimeSeries training) {
        ForecastModel model = factory.create(variant);
        assertEquals(variant, model.getVariant());
        return model.fit(training, TEMPERATURE, config(variant));
    }

    // ========== Contract Tests ==========

    @Test
    @DisplayName("Seasonal decomposition forecasts the weekly cycle")
    void testSeasonalDecomposition() {
        double[] all = SeriesFixtures.seasonal(127, 11L, 0.3);
        TimeSeries training = SeriesFixtures.series("sd", Arrays.copyOf(all, 120));

        ForecastResult result = fit(ModelVariant.SEASONAL_DECOMPOSITION, training).predict(HORIZON);

        assertContract(result, training);
        assertTrue(meanAbsoluteError(result, all, 120) < 3.0);
    }

    @Test
    @DisplayName("Trend-holiday model forecasts the weekly cycle")
    void testTrendHoliday() {
        double[] all = SeriesFixtures.seasonal(127, 12L, 0.3);
        TimeSeries training = SeriesFixtures.series("th", Arrays.copyOf(all, 120));

        ForecastResult result = fit(ModelVariant.TREND_HOLIDAY, training).predict(HORIZON);

        assertContract(result, training);
        assertTrue(meanAbsoluteError(result, all, 120) < 3.0);
    }

    @Test
    @DisplayName("Autoregressive model returns contiguous intervals and in-sample predictions")
    void testAutoregressive() {
        TimeSeries training = SeriesFixtures.series("ar", SeriesFixtures.seasonal(120, 13L, 0.3));

        FittedModel fitted = fit(ModelVariant.AUTOREGRESSIVE, training);

        assertContract(fitted.predict(HORIZON), training);
        assertEquals(training.size(), fitted.fittedValues().length);
    }

    @Test
    @DisplayName("Sequence-learning model returns contiguous intervals")
    void testSequenceLearning() {
        TimeSeries training = SeriesFixtures.series("lstm", SeriesFixtures.seasonal(120, 14L, 0.3));

        ForecastResult result = fit(ModelVariant.SEQUENCE_LEARNING, training).predict(HORIZON);

        assertContract(result, training);
    }

    @Test
    @DisplayName("Higher confidence gives wider intervals")
    void testConfidenceLevel() {
        TimeSeries training = SeriesFixtures.series("ci", SeriesFixtures.seasonal(120, 15L, 0.5));
        ForecastModel model = factory.create(ModelVariant.AUTOREGRESSIVE);
        ModelConfig narrow = config(ModelVariant.AUTOREGRESSIVE).toBuilder()
                .hyperparameters(Map.of(PredictionIntervals.CONFIDENCE_LEVEL, 0.8))
                .build();
        ModelConfig wide = narrow.toBuilder()
                .hyperparameters(Map.of(PredictionIntervals.CONFIDENCE_LEVEL, 0.99))
                .build();

        double narrowWidth = model.fit(training, TEMPERATURE, narrow).predict(HORIZON).meanIntervalWidth();
        double wideWidth = model.fit(training, TEMPERATURE, wide).predict(HORIZON).meanIntervalWidth();

        assertTrue(wideWidth > narrowWidth);
    }

    // ========== Failure Tests ==========

    @Test
    @DisplayName("Series shorter than two seasonal cycles is rejected")
    void testInsufficientData() {
        TimeSeries training = SeriesFixtures.series("short", SeriesFixtures.seasonal(10, 16L, 0.3));
        ModelConfig yearly = config(ModelVariant.SEASONAL_DECOMPOSITION).toBuilder()
                .seasonalPeriods(Set.of(365))
                .build();
        ForecastModel model = factory.create(ModelVariant.SEASONAL_DECOMPOSITION);

        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> model.fit(training, TEMPERATURE, yearly));
        assertEquals(ModelVariant.SEASONAL_DECOMPOSITION, e.getVariant());
        assertEquals(730, e.getRequired());
    }

    @Test
    @DisplayName("Missing values in the training series are rejected")
    void testMissingValues() {
        double[] values = SeriesFixtures.seasonal(60, 17L, 0.3);
        values[20] = Double.NaN;
        TimeSeries training = SeriesFixtures.series("nan", values);
        ForecastModel model = factory.create(ModelVariant.AUTOREGRESSIVE);

        assertThrows(ModelFitException.class,
                () -> model.fit(training, TEMPERATURE, config(ModelVariant.AUTOREGRESSIVE)));
    }

    @Test
    @DisplayName("Unknown variable is rejected")
    void testUnknownVariable() {
        TimeSeries training = SeriesFixtures.series("var", SeriesFixtures.seasonal(60, 18L, 0.3));
        ForecastModel model = factory.create(ModelVariant.TREND_HOLIDAY);

        assertThrows(ModelFitException.class,
                () -> model.fit(training, "humidity", config(ModelVariant.TREND_HOLIDAY)));
    }

    private static double meanAbsoluteError(ForecastResult result, double[] all, int origin) {
        double[] point = result.pointEstimates();
        double sum = 0;
        for (int h = 0; h < point.length; h++) {
            sum += Math.abs(all[origin + h] - point[h]);
        }
        return sum / point.length;
    }
}
