package com.rechargeengine.core.preprocess;

import com.rechargeengine.core.config.AggregationMethod;
import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.config.ResampleRule;
import com.rechargeengine.core.exception.EmptySeriesException;
import com.rechargeengine.core.model.Reading;
import com.rechargeengine.core.model.TimeSeries;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cleans, resamples, smooths and labels a raw water-level series.
 *
 * <h3>Stages</h3>
 * <ol>
 * <li>Readings with a non-finite level are dropped.</li>
 * <li>When {@code removeOutliers} is set, readings whose level lies more than
 * {@code outlierThreshold} standard deviations from the mean are dropped.</li>
 * <li>Readings are grouped into buckets by {@link ResampleRule}; each bucket
 * becomes one reading at the bucket start. Levels are combined with the
 * {@link AggregationMethod}, precipitation is summed. Buckets without
 * readings produce nothing.</li>
 * <li>A trailing moving average of {@code smoothingWindow} readings replaces
 * each level; the first {@code window - 1} readings have no full window and
 * are dropped.</li>
 * <li>Every reading is labelled with its water year.</li>
 * </ol>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeSeriesPreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesPreprocessor.class);

    /**
     * Run every preprocessing stage.
     *
     * @param series     raw series
     * @param parameters calculation parameters
     * @return a new series with water-year labels
     * @throws EmptySeriesException if no reading survives filtering
     */
    public TimeSeries process(TimeSeries series, CalculationParameters parameters) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");

        List<Reading> readings = dropNonFinite(series.getReadings());
        if (parameters.isRemoveOutliers()) {
            readings = removeOutliers(readings, parameters.getOutlierThreshold());
        }
        readings = resample(readings, parameters.getResampleRule(), parameters.getAggregationMethod());
        readings = smooth(readings, parameters.getSmoothingWindow());

        if (readings.isEmpty()) {
            throw new EmptySeriesException("No readings left after preprocessing " + series.size()
                    + " raw reading(s)");
        }
        List<Reading> labelled = assignWaterYears(readings, parameters.waterYearStart());

        LOG.info("Preprocessed {} raw reading(s) into {} (resample={}, smoothingWindow={})",
                series.size(), labelled.size(), parameters.getResampleRule(), parameters.getSmoothingWindow());
        return new TimeSeries(labelled);
    }

    // ---------------------------------------------------------------
    // Stages
    // ---------------------------------------------------------------

    List<Reading> dropNonFinite(List<Reading> readings) {
        List<Reading> kept = new ArrayList<>(readings.size());
        for (Reading reading : readings) {
            if (Double.isFinite(reading.getWaterLevel())) {
                kept.add(reading);
            }
        }
        if (kept.size() < readings.size()) {
            LOG.debug("Dropped {} reading(s) with a missing or non-finite level", readings.size() - kept.size());
        }
        return kept;
    }

    List<Reading> removeOutliers(List<Reading> readings, double zThreshold) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        readings.forEach(r -> stats.addValue(r.getWaterLevel()));
        double mean = stats.getMean();
        double std = stats.getStandardDeviation();
        if (readings.size() < 2 || !(std > 0.0)) {
            return readings;
        }
        List<Reading> kept = new ArrayList<>(readings.size());
        for (Reading reading : readings) {
            double z = Math.abs(reading.getWaterLevel() - mean) / std;
            if (z <= zThreshold) {
                kept.add(reading);
            } else {
                LOG.debug("Dropping outlier at {} (level={}, z={})", reading.getTimestamp(),
                        reading.getWaterLevel(), z);
            }
        }
        return kept;
    }

    List<Reading> resample(List<Reading> readings, ResampleRule rule, AggregationMethod method) {
        if (rule == ResampleRule.NONE) {
            return readings;
        }
        Map<LocalDateTime, List<Reading>> buckets = new LinkedHashMap<>();
        for (Reading reading : readings) {
            buckets.computeIfAbsent(rule.bucketOf(reading.getTimestamp()), k -> new ArrayList<>()).add(reading);
        }
        List<Reading> resampled = new ArrayList<>(buckets.size());
        for (Map.Entry<LocalDateTime, List<Reading>> bucket : buckets.entrySet()) {
            List<Reading> members = bucket.getValue();
            resampled.add(new Reading(bucket.getKey(), aggregate(members, method), sumPrecipitation(members)));
        }
        return resampled;
    }

    List<Reading> smooth(List<Reading> readings, int window) {
        if (window <= 1) {
            return readings;
        }
        List<Reading> smoothed = new ArrayList<>(Math.max(0, readings.size() - window + 1));
        double runningSum = 0.0;
        for (int i = 0; i < readings.size(); i++) {
            runningSum += readings.get(i).getWaterLevel();
            if (i >= window) {
                runningSum -= readings.get(i - window).getWaterLevel();
            }
            if (i >= window - 1) {
                smoothed.add(readings.get(i).withWaterLevel(runningSum / window));
            }
        }
        return smoothed;
    }

    List<Reading> assignWaterYears(List<Reading> readings, MonthDay start) {
        List<Reading> labelled = new ArrayList<>(readings.size());
        for (Reading reading : readings) {
            labelled.add(reading.withWaterYear(WaterYears.of(reading.getTimestamp(), start)));
        }
        return labelled;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static double aggregate(List<Reading> members, AggregationMethod method) {
        double[] levels = members.stream().mapToDouble(Reading::getWaterLevel).toArray();
        return switch (method) {
            case MEAN -> new DescriptiveStatistics(levels).getMean();
            case MEDIAN -> new Median().evaluate(levels);
            case LAST -> levels[levels.length - 1];
        };
    }

    private static Double sumPrecipitation(List<Reading> members) {
        Double total = null;
        for (Reading reading : members) {
            if (reading.getPrecipitation() != null) {
                total = (total == null ? 0.0 : total) + reading.getPrecipitation();
            }
        }
        return total;
    }
}
