package com.rechargeengine.core.aggregation;

import com.rechargeengine.core.model.SeasonalSummary;
import com.rechargeengine.core.model.YearlySummary;

import java.util.List;
import java.util.Map;

/**
 * Totals derived from the events of one calculation.
 *
 * @since 1.0.0
 */
public final class Aggregation {

    private final List<YearlySummary> yearlySummaries;
    private final List<SeasonalSummary> seasonalSummaries;
    private final Map<String, Double> parameterVariability;
    private final double totalRecharge;
    private final double annualRate;

    Aggregation(List<YearlySummary> yearlySummaries, List<SeasonalSummary> seasonalSummaries,
            Map<String, Double> parameterVariability, double totalRecharge, double annualRate) {
        this.yearlySummaries = List.copyOf(yearlySummaries);
        this.seasonalSummaries = seasonalSummaries != null ? List.copyOf(seasonalSummaries) : null;
        this.parameterVariability = parameterVariability;
        this.totalRecharge = totalRecharge;
        this.annualRate = annualRate;
    }

    public List<YearlySummary> getYearlySummaries() {
        return yearlySummaries;
    }

    /**
     * @return per-season totals, or {@code null} when not computed
     */
    public List<SeasonalSummary> getSeasonalSummaries() {
        return seasonalSummaries;
    }

    /**
     * @return coefficient of variation of each curve parameter across
     *         partition curves, or {@code null} when not applicable
     */
    public Map<String, Double> getParameterVariability() {
        return parameterVariability;
    }

    public double getTotalRecharge() {
        return totalRecharge;
    }

    public double getAnnualRate() {
        return annualRate;
    }
}
