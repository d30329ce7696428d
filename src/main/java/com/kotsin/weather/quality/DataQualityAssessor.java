package com.kotsin.weather.quality;

import com.kotsin.weather.config.WeatherInsightProperties;
import com.kotsin.weather.domain.model.GapTreatment;
import com.kotsin.weather.domain.model.ImputationMethod;
import com.kotsin.weather.domain.model.ModelConfig;
import com.kotsin.weather.domain.model.QualityGrade;
import com.kotsin.weather.domain.model.QualityReport;
import com.kotsin.weather.domain.model.TimeSeries;
import com.kotsin.weather.domain.model.VariableSummary;
import com.kotsin.weather.domain.validator.SeriesSanityValidator;
import com.kotsin.weather.exception.InsufficientDataException;
import com.kotsin.weather.forecast.ForecastModelFactory;
import com.kotsin.weather.util.MathUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * DataQualityAssessor - scores a raw series and derives the cleaned working copy.
 *
 * Dimensions (all in [0, 1]):
 * - completeness: share of observed values
 * - consistency: calendar continuity and absence of implausible day-over-day jumps
 * - accuracy: share of observed values inside the physical range of their variable
 * - timeliness: freshness of the last observation relative to an as-of date
 *
 * Physically implausible values are treated as missing before imputation.
 * Pure function of its inputs; the caller's series is never modified.
 */
@Component
@Slf4j
public class DataQualityAssessor {

    private final WeatherInsightProperties.QualityConfig config;
    private final ForecastModelFactory modelFactory;
    private final MissingValueImputer imputer;

    public DataQualityAssessor(WeatherInsightProperties properties, ForecastModelFactory modelFactory) {
        this.config = properties.getQuality();
        this.modelFactory = modelFactory;
        this.imputer = new MissingValueImputer(config.getMaxLinearGap(), config.getMaxImputationGap());
    }

    /**
     * Assess and clean a series.
     *
     * @param series  raw input series
     * @param models  configured models; the series must satisfy at least the least demanding of them
     * @param asOf    reference date for timeliness, or null to skip the timeliness penalty
     * @throws InsufficientDataException when no configured model could fit a series this short
     */
    public QualityAssessment assess(TimeSeries series, List<ModelConfig> models, LocalDate asOf) {
        checkLength(series, models);

        int n = series.size();
        List<LocalDate> dates = series.dates();
        TreeSet<Integer> periods = new TreeSet<>();
        models.forEach(m -> periods.addAll(m.getSeasonalPeriods()));

        QualityReport.QualityReportBuilder report = QualityReport.builder().seriesId(series.getSeriesId());

        long totalValues = 0;
        long missingValues = 0;
        long observedValues = 0;
        long implausibleValues = 0;
        long jumpPairs = 0;
        long jumps = 0;

        TimeSeries cleaned = series;
        TimeSeries modelInput = series;
        for (String variable : series.getVariables()) {
            double[] raw = series.values(variable);
            int missing = series.missingCount(variable);
            int implausible = SeriesSanityValidator.countImplausible(variable, raw);

            totalValues += n;
            missingValues += missing;
            observedValues += n - missing;
            implausibleValues += implausible;
            jumpPairs += Math.max(0, n - 1);
            jumps += SeriesSanityValidator.countImplausibleJumps(raw, config.getJumpFactor());

            report.summary(variable, summarize(variable, raw, missing));

            double[] plausible = raw.clone();
            for (int t = 0; t < n; t++) {
                if (!Double.isNaN(plausible[t]) && !SeriesSanityValidator.isPlausible(variable, plausible[t])) {
                    plausible[t] = Double.NaN;
                }
            }
            if (implausible > 0) {
                report.recommendation(String.format(
                        "%s: %d values outside the physical range were treated as missing", variable, implausible));
            }

            MissingValueImputer.Imputation imputation = imputer.impute(variable, dates, plausible, periods);
            imputation.getTreatments().forEach(report::treatment);
            long leftMissing = imputation.getTreatments().stream()
                    .filter(g -> g.getMethod() == ImputationMethod.LEFT_MISSING)
                    .mapToInt(GapTreatment::getLength)
                    .sum();
            if (leftMissing > 0) {
                report.recommendation(String.format(
                        "%s: %d values in long gaps could not be imputed; consider re-fetching that period",
                        variable, leftMissing));
            }
            if (MathUtils.countFinite(plausible) == 0) {
                report.recommendation(String.format("%s: no usable observations", variable));
            }

            cleaned = cleaned.withValues(variable, imputation.getValues());
            modelInput = modelInput.withValues(variable, MissingValueImputer.fillRemaining(imputation.getValues()));
        }

        int calendarGaps = SeriesSanityValidator.countCalendarGaps(series);
        double completeness = totalValues == 0 ? 0.0 : 1.0 - (double) missingValues / totalValues;
        double continuity = n < 2 ? 1.0 : 1.0 - (double) calendarGaps / (n - 1);
        double smoothness = jumpPairs == 0 ? 1.0 : 1.0 - (double) jumps / jumpPairs;
        double consistency = MathUtils.clampUnit(continuity * smoothness);
        double accuracy = observedValues == 0 ? 0.0 : 1.0 - (double) implausibleValues / observedValues;
        double timeliness = timeliness(series.lastDate(), asOf);

        double weightSum = config.getCompletenessWeight() + config.getConsistencyWeight()
                + config.getAccuracyWeight() + config.getTimelinessWeight();
        double overall = MathUtils.safeDivide(
                config.getCompletenessWeight() * completeness
                        + config.getConsistencyWeight() * consistency
                        + config.getAccuracyWeight() * accuracy
                        + config.getTimelinessWeight() * timeliness,
                weightSum, 0.0);
        overall = MathUtils.clampUnit(overall);
        QualityGrade grade = QualityGrade.fromScore(overall);

        if (calendarGaps > 0) {
            report.recommendation(String.format(
                    "%d calendar gaps between consecutive dates; supply one point per day with explicit missing values",
                    calendarGaps));
        }
        if (jumps > 0) {
            report.recommendation(String.format("%d implausible day-over-day jumps; check sensor or unit changes", jumps));
        }
        if (completeness < 0.9) {
            report.recommendation(String.format("Completeness %.1f%% is low; forecasts rely on imputed values",
                    completeness * 100));
        }
        if (timeliness < 1.0) {
            report.recommendation(String.format("Last observation %s is stale relative to %s", series.lastDate(), asOf));
        }

        QualityReport built = report
                .completeness(completeness)
                .consistency(consistency)
                .accuracy(accuracy)
                .timeliness(timeliness)
                .overall(overall)
                .grade(grade)
                .build();

        log.info("[QUALITY] {}: overall={} grade={} completeness={} consistency={} accuracy={} gapsTreated={}",
                series.getSeriesId(), String.format("%.3f", overall), grade,
                String.format("%.3f", completeness), String.format("%.3f", consistency),
                String.format("%.3f", accuracy), built.getTreatments().size());
        return new QualityAssessment(built, cleaned, modelInput);
    }

    /**
     * Minimum length check: fail only when no configured model could fit, or below the absolute floor
     */
    private void checkLength(TimeSeries series, Collection<ModelConfig> models) {
        int required = models.stream()
                .mapToInt(modelFactory::minimumPoints)
                .min()
                .orElse(0);
        required = Math.max(required, config.getMinimumSeriesLength());
        if (series.size() < required) {
            throw new InsufficientDataException(String.format(
                    "Series %s has %d points; at least %d required by the configured models",
                    series.getSeriesId(), series.size(), required), series.size(), required);
        }
    }

    private double timeliness(LocalDate last, LocalDate asOf) {
        if (asOf == null || last == null) {
            return 1.0;
        }
        long lag = ChronoUnit.DAYS.between(last, asOf);
        if (lag <= 1) {
            return 1.0;
        }
        int horizon = Math.max(2, config.getTimelinessHorizonDays());
        return MathUtils.clampUnit(1.0 - (double) (lag - 1) / (horizon - 1));
    }

    private static VariableSummary summarize(String variable, double[] values, int missing) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        int zeros = 0;
        int negatives = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                stats.addValue(v);
                if (v == 0.0) {
                    zeros++;
                } else if (v < 0.0) {
                    negatives++;
                }
            }
        }
        boolean empty = stats.getN() == 0;
        return VariableSummary.builder()
                .variable(variable)
                .count((int) stats.getN())
                .missing(missing)
                .mean(empty ? Double.NaN : stats.getMean())
                .std(stats.getN() < 2 ? 0.0 : stats.getStandardDeviation())
                .min(empty ? Double.NaN : stats.getMin())
                .max(empty ? Double.NaN : stats.getMax())
                .median(empty ? Double.NaN : stats.getPercentile(50))
                .zeroCount(zeros)
                .negativeCount(negatives)
                .build();
    }
}
