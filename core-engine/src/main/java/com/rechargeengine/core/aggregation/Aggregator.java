package com.rechargeengine.core.aggregation;

import com.rechargeengine.core.model.CurveType;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.RechargeMethod;
import com.rechargeengine.core.model.Season;
import com.rechargeengine.core.model.SeasonalSummary;
import com.rechargeengine.core.model.TimeSeries;
import com.rechargeengine.core.model.YearlySummary;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Groups recharge events into water-year and seasonal totals.
 *
 * <p>
 * Annual rates scale recharge to inches per year over the span it was
 * observed in: {@code total * 365 / spanDays}. A zero-day span, such as a
 * year with a single event, is treated as one day: {@code total * 365}.
 * </p>
 *
 * @since 1.0.0
 */
public class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    static final double DAYS_PER_YEAR = 365.0;

    /**
     * @param events chronological events
     * @param series preprocessed series the events were detected in
     * @param method calculation method
     * @param curve  master curve, or {@code null} for the rise method
     * @return totals
     */
    public Aggregation aggregate(List<RechargeEvent> events, TimeSeries series, RechargeMethod method,
            MasterCurve curve) {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(series, "series must not be null");

        boolean extended = method == RechargeMethod.ERC;
        List<YearlySummary> yearly = yearlySummaries(events, extended);
        List<SeasonalSummary> seasonal = extended ? seasonalSummaries(events) : null;
        Map<String, Double> variability = extended ? parameterVariability(curve) : null;

        double total = events.stream().mapToDouble(RechargeEvent::getRechargeInches).sum();
        double annualRate = annualRate(total, series.spanDays());

        LOG.info("Aggregated {} event(s) into {} water year(s): total={} in, annualRate={} in/yr",
                events.size(), yearly.size(), total, annualRate);
        return new Aggregation(yearly, seasonal, variability, total, annualRate);
    }

    List<YearlySummary> yearlySummaries(List<RechargeEvent> events, boolean includeQuality) {
        Map<Integer, List<RechargeEvent>> byYear = new TreeMap<>();
        for (RechargeEvent event : events) {
            Integer year = Objects.requireNonNull(event.getWaterYear(),
                    "event at " + event.getEventDate() + " has no water year");
            byYear.computeIfAbsent(year, k -> new ArrayList<>()).add(event);
        }

        List<YearlySummary> summaries = new ArrayList<>(byYear.size());
        for (Map.Entry<Integer, List<RechargeEvent>> entry : byYear.entrySet()) {
            List<RechargeEvent> yearEvents = entry.getValue();
            DescriptiveStatistics deviations = new DescriptiveStatistics();
            double total = 0.0;
            DescriptiveStatistics quality = new DescriptiveStatistics();
            for (RechargeEvent event : yearEvents) {
                deviations.addValue(event.getDeviation());
                total += event.getRechargeInches();
                if (event.getQualityScore() != null) {
                    quality.addValue(event.getQualityScore());
                }
            }
            double span = TimeSeries.daysBetween(yearEvents.get(0).getEventDate(),
                    yearEvents.get(yearEvents.size() - 1).getEventDate());
            Double averageQuality = includeQuality && quality.getN() > 0 ? quality.getMean() : null;
            summaries.add(new YearlySummary(entry.getKey(), total, yearEvents.size(), deviations.getMax(),
                    deviations.getMean(), annualRate(total, span), averageQuality));
        }
        return Collections.unmodifiableList(summaries);
    }

    List<SeasonalSummary> seasonalSummaries(List<RechargeEvent> events) {
        Map<Season, List<RechargeEvent>> bySeason = new EnumMap<>(Season.class);
        for (RechargeEvent event : events) {
            bySeason.computeIfAbsent(event.getSeason(), k -> new ArrayList<>()).add(event);
        }
        List<SeasonalSummary> summaries = new ArrayList<>(bySeason.size());
        for (Map.Entry<Season, List<RechargeEvent>> entry : bySeason.entrySet()) {
            List<RechargeEvent> seasonEvents = entry.getValue();
            double total = seasonEvents.stream().mapToDouble(RechargeEvent::getRechargeInches).sum();
            double averageDeviation = seasonEvents.stream().mapToDouble(RechargeEvent::getDeviation)
                    .average().orElse(0.0);
            summaries.add(new SeasonalSummary(entry.getKey(), seasonEvents.size(), total, averageDeviation));
        }
        return Collections.unmodifiableList(summaries);
    }

    /**
     * Coefficient of variation (sample standard deviation over absolute mean)
     * of every parameter across the partition curves of a multi-segment
     * curve. Parameters whose mean is zero are omitted.
     *
     * @param curve master curve, may be {@code null}
     * @return parameter name to CV, or {@code null} when fewer than two
     *         partition curves exist
     */
    Map<String, Double> parameterVariability(MasterCurve curve) {
        if (curve == null || curve.getCurveType() != CurveType.MULTI_SEGMENT
                || curve.getPartitions() == null || curve.getPartitions().size() < 2) {
            return null;
        }
        Map<String, Double> variability = new LinkedHashMap<>();
        for (String name : curve.getParameters().keySet()) {
            DescriptiveStatistics values = new DescriptiveStatistics();
            for (MasterCurve partition : curve.getPartitions().values()) {
                Double value = partition.getParameters().get(name);
                if (value != null) {
                    values.addValue(value);
                }
            }
            if (values.getN() >= 2 && values.getMean() != 0.0) {
                variability.put(name, values.getStandardDeviation() / Math.abs(values.getMean()));
            }
        }
        LOG.debug("Parameter variability across {} partition(s): {}", curve.getPartitions().size(), variability);
        return variability;
    }

    static double annualRate(double total, double spanDays) {
        return spanDays > 0.0 ? total * DAYS_PER_YEAR / spanDays : total * DAYS_PER_YEAR;
    }
}
