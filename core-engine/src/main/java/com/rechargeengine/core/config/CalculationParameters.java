package com.rechargeengine.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.rechargeengine.core.exception.ValidationException;
import com.rechargeengine.core.model.CrossValidationMethod;
import com.rechargeengine.core.model.CurveType;
import com.rechargeengine.core.model.RechargeMethod;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parameter set of one recharge calculation.
 *
 * <p>
 * A mutable JavaBean so that SnakeYAML can populate it; the engine works on a
 * {@link #copy()} taken after {@link #validate()}, which is the immutable
 * snapshot every pipeline stage reads. Example YAML:
 * </p>
 *
 * <pre>
 * method: ERC
 * specificYield: 0.2
 * threshold: 0.1
 * minRecessionLength: 10
 * curveType: MULTI_SEGMENT
 * crossValidationMethod: K_FOLD
 * partitionBreakpoints: ["2019-10-01"]
 * </pre>
 *
 * <p>
 * Lengths of time ({@code minRecessionLength}, {@code postPrecipitationLag},
 * {@code antecedentPeriod}, {@code minTimeBetweenEvents}) are in days; levels
 * and thresholds are in feet.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalculationParameters implements Serializable {

    private static final long serialVersionUID = 1L;

    private RechargeMethod method = RechargeMethod.MRC;
    private double specificYield = 0.2;
    private double threshold = 0.1;

    // Segment identification
    private int minRecessionLength = 10;
    private double fluctuationTolerance = 0.01;
    private double precipitationTolerance = 0.1;
    private int postPrecipitationLag = 2;
    private int antecedentPeriod = 7;
    private double minSegmentQuality = 0.0;

    // Curve fitting
    private CurveType curveType = CurveType.EXPONENTIAL;
    private int polynomialDegree = 2;
    private CurveType seasonalBaseCurveType = CurveType.EXPONENTIAL;
    private List<String> partitionBreakpoints = new ArrayList<>();
    private int minSegmentsPerPartition = 2;
    private double minCurveRSquared = 0.7;

    // Cross-validation
    private CrossValidationMethod crossValidationMethod = CrossValidationMethod.K_FOLD;
    private int foldCount = 5;
    private double temporalTrainFraction = 0.7;
    private Long crossValidationSeed;

    // Preprocessing
    private int waterYearStartMonth = 10;
    private int waterYearStartDay = 1;
    private ResampleRule resampleRule = ResampleRule.NONE;
    private AggregationMethod aggregationMethod = AggregationMethod.MEAN;
    private int smoothingWindow = 1;
    private boolean removeOutliers;
    private double outlierThreshold = 3.0;

    // Event detection
    private double maxRiseRate = 10.0;
    private double minTimeBetweenEvents = 1.0;
    private QualityWeights qualityWeights = new QualityWeights();

    private boolean parallel;

    /**
     * Verify every parameter and report all problems at once.
     *
     * @throws ValidationException if one or more parameters are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (method == null) {
            errors.add("'method' is required (RISE, MRC or ERC)");
        }
        if (!(specificYield > 0.0 && specificYield <= 1.0)) {
            errors.add("'specificYield' must be in (0, 1], got " + specificYield);
        }
        if (!(threshold >= 0.0) || Double.isInfinite(threshold)) {
            errors.add("'threshold' must be a finite value >= 0, got " + threshold);
        }
        if (minRecessionLength < 1) {
            errors.add("'minRecessionLength' must be >= 1 day, got " + minRecessionLength);
        }
        if (!(fluctuationTolerance >= 0.0)) {
            errors.add("'fluctuationTolerance' must be >= 0, got " + fluctuationTolerance);
        }
        if (!(precipitationTolerance >= 0.0)) {
            errors.add("'precipitationTolerance' must be >= 0, got " + precipitationTolerance);
        }
        if (postPrecipitationLag < 0) {
            errors.add("'postPrecipitationLag' must be >= 0 days, got " + postPrecipitationLag);
        }
        if (antecedentPeriod < 1) {
            errors.add("'antecedentPeriod' must be >= 1 day, got " + antecedentPeriod);
        }
        if (!(minSegmentQuality >= 0.0 && minSegmentQuality <= 1.0)) {
            errors.add("'minSegmentQuality' must be in [0, 1], got " + minSegmentQuality);
        }
        if (curveType == null) {
            errors.add("'curveType' is required");
        }
        if (polynomialDegree < 2 || polynomialDegree > 4) {
            errors.add("'polynomialDegree' must be between 2 and 4, got " + polynomialDegree);
        }
        if (seasonalBaseCurveType == null || seasonalBaseCurveType == CurveType.MULTI_SEGMENT) {
            errors.add("'seasonalBaseCurveType' must be a single-curve type, got " + seasonalBaseCurveType);
        }
        validateBreakpoints(errors);
        if (minSegmentsPerPartition < 1) {
            errors.add("'minSegmentsPerPartition' must be >= 1, got " + minSegmentsPerPartition);
        }
        if (!(minCurveRSquared >= 0.0 && minCurveRSquared <= 1.0)) {
            errors.add("'minCurveRSquared' must be in [0, 1], got " + minCurveRSquared);
        }
        if (crossValidationMethod == null) {
            errors.add("'crossValidationMethod' is required");
        }
        if (foldCount < 2) {
            errors.add("'foldCount' must be >= 2, got " + foldCount);
        }
        if (!(temporalTrainFraction > 0.0 && temporalTrainFraction < 1.0)) {
            errors.add("'temporalTrainFraction' must be in (0, 1), got " + temporalTrainFraction);
        }
        try {
            MonthDay.of(waterYearStartMonth, waterYearStartDay);
        } catch (DateTimeException e) {
            errors.add("'waterYearStartMonth'/'waterYearStartDay' do not form a valid date: "
                    + waterYearStartMonth + "/" + waterYearStartDay);
        }
        if (resampleRule == null) {
            errors.add("'resampleRule' is required");
        }
        if (aggregationMethod == null) {
            errors.add("'aggregationMethod' is required");
        }
        if (smoothingWindow < 1) {
            errors.add("'smoothingWindow' must be >= 1 reading, got " + smoothingWindow);
        }
        if (!(outlierThreshold > 0.0)) {
            errors.add("'outlierThreshold' must be > 0, got " + outlierThreshold);
        }
        if (!(maxRiseRate > 0.0)) {
            errors.add("'maxRiseRate' must be > 0 ft/day, got " + maxRiseRate);
        }
        if (!(minTimeBetweenEvents >= 0.0)) {
            errors.add("'minTimeBetweenEvents' must be >= 0 days, got " + minTimeBetweenEvents);
        }
        if (qualityWeights == null) {
            errors.add("'qualityWeights' is required");
        } else if (qualityWeights.getMagnitude() < 0 || qualityWeights.getCrossValidation() < 0
                || qualityWeights.getSeasonal() < 0 || !(qualityWeights.total() > 0)) {
            errors.add("'qualityWeights' must be non-negative with a positive sum, got " + qualityWeights);
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private void validateBreakpoints(List<String> errors) {
        LocalDate previous = null;
        for (String breakpoint : partitionBreakpoints) {
            LocalDate date;
            try {
                date = LocalDate.parse(Objects.requireNonNull(breakpoint, "breakpoint"));
            } catch (RuntimeException e) {
                errors.add("'partitionBreakpoints' entry is not an ISO date (yyyy-MM-dd): " + breakpoint);
                return;
            }
            if (previous != null && !date.isAfter(previous)) {
                errors.add("'partitionBreakpoints' must be strictly increasing, got " + partitionBreakpoints);
                return;
            }
            previous = date;
        }
    }

    /**
     * @return breakpoint dates parsed from {@link #getPartitionBreakpoints()}
     */
    public List<LocalDate> breakpointDates() {
        return partitionBreakpoints.stream().map(LocalDate::parse).toList();
    }

    /**
     * @return the water-year start as a month and day
     */
    public MonthDay waterYearStart() {
        return MonthDay.of(waterYearStartMonth, waterYearStartDay);
    }

    /**
     * Deep copy, so that later mutation of this bean cannot reach a running or
     * finished calculation.
     *
     * @return independent copy
     */
    public CalculationParameters copy() {
        CalculationParameters copy = new CalculationParameters();
        copy.method = method;
        copy.specificYield = specificYield;
        copy.threshold = threshold;
        copy.minRecessionLength = minRecessionLength;
        copy.fluctuationTolerance = fluctuationTolerance;
        copy.precipitationTolerance = precipitationTolerance;
        copy.postPrecipitationLag = postPrecipitationLag;
        copy.antecedentPeriod = antecedentPeriod;
        copy.minSegmentQuality = minSegmentQuality;
        copy.curveType = curveType;
        copy.polynomialDegree = polynomialDegree;
        copy.seasonalBaseCurveType = seasonalBaseCurveType;
        copy.partitionBreakpoints = new ArrayList<>(partitionBreakpoints);
        copy.minSegmentsPerPartition = minSegmentsPerPartition;
        copy.minCurveRSquared = minCurveRSquared;
        copy.crossValidationMethod = crossValidationMethod;
        copy.foldCount = foldCount;
        copy.temporalTrainFraction = temporalTrainFraction;
        copy.crossValidationSeed = crossValidationSeed;
        copy.waterYearStartMonth = waterYearStartMonth;
        copy.waterYearStartDay = waterYearStartDay;
        copy.resampleRule = resampleRule;
        copy.aggregationMethod = aggregationMethod;
        copy.smoothingWindow = smoothingWindow;
        copy.removeOutliers = removeOutliers;
        copy.outlierThreshold = outlierThreshold;
        copy.maxRiseRate = maxRiseRate;
        copy.minTimeBetweenEvents = minTimeBetweenEvents;
        copy.qualityWeights = qualityWeights != null ? qualityWeights.copy() : null;
        copy.parallel = parallel;
        return copy;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML and Jackson)
    // ---------------------------------------------------------------

    public RechargeMethod getMethod() {
        return method;
    }

    public void setMethod(RechargeMethod method) {
        this.method = method;
    }

    public double getSpecificYield() {
        return specificYield;
    }

    public void setSpecificYield(double specificYield) {
        this.specificYield = specificYield;
    }

    /**
     * @return rise threshold (RISE) or deviation threshold (MRC, ERC), in feet
     */
    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getMinRecessionLength() {
        return minRecessionLength;
    }

    public void setMinRecessionLength(int minRecessionLength) {
        this.minRecessionLength = minRecessionLength;
    }

    public double getFluctuationTolerance() {
        return fluctuationTolerance;
    }

    public void setFluctuationTolerance(double fluctuationTolerance) {
        this.fluctuationTolerance = fluctuationTolerance;
    }

    public double getPrecipitationTolerance() {
        return precipitationTolerance;
    }

    public void setPrecipitationTolerance(double precipitationTolerance) {
        this.precipitationTolerance = precipitationTolerance;
    }

    public int getPostPrecipitationLag() {
        return postPrecipitationLag;
    }

    public void setPostPrecipitationLag(int postPrecipitationLag) {
        this.postPrecipitationLag = postPrecipitationLag;
    }

    public int getAntecedentPeriod() {
        return antecedentPeriod;
    }

    public void setAntecedentPeriod(int antecedentPeriod) {
        this.antecedentPeriod = antecedentPeriod;
    }

    public double getMinSegmentQuality() {
        return minSegmentQuality;
    }

    public void setMinSegmentQuality(double minSegmentQuality) {
        this.minSegmentQuality = minSegmentQuality;
    }

    public CurveType getCurveType() {
        return curveType;
    }

    public void setCurveType(CurveType curveType) {
        this.curveType = curveType;
    }

    public int getPolynomialDegree() {
        return polynomialDegree;
    }

    public void setPolynomialDegree(int polynomialDegree) {
        this.polynomialDegree = polynomialDegree;
    }

    public CurveType getSeasonalBaseCurveType() {
        return seasonalBaseCurveType;
    }

    public void setSeasonalBaseCurveType(CurveType seasonalBaseCurveType) {
        this.seasonalBaseCurveType = seasonalBaseCurveType;
    }

    /**
     * @return unmodifiable list of ISO breakpoint dates; empty means seasonal
     *         partitioning
     */
    public List<String> getPartitionBreakpoints() {
        return Collections.unmodifiableList(partitionBreakpoints);
    }

    public void setPartitionBreakpoints(List<String> partitionBreakpoints) {
        this.partitionBreakpoints = partitionBreakpoints != null
                ? new ArrayList<>(partitionBreakpoints)
                : new ArrayList<>();
    }

    public int getMinSegmentsPerPartition() {
        return minSegmentsPerPartition;
    }

    public void setMinSegmentsPerPartition(int minSegmentsPerPartition) {
        this.minSegmentsPerPartition = minSegmentsPerPartition;
    }

    /**
     * @return curve R² below which the result carries a warning
     */
    public double getMinCurveRSquared() {
        return minCurveRSquared;
    }

    public void setMinCurveRSquared(double minCurveRSquared) {
        this.minCurveRSquared = minCurveRSquared;
    }

    public CrossValidationMethod getCrossValidationMethod() {
        return crossValidationMethod;
    }

    public void setCrossValidationMethod(CrossValidationMethod crossValidationMethod) {
        this.crossValidationMethod = crossValidationMethod;
    }

    /**
     * @return number of folds for {@link CrossValidationMethod#K_FOLD}
     */
    public int getFoldCount() {
        return foldCount;
    }

    public void setFoldCount(int foldCount) {
        this.foldCount = foldCount;
    }

    public double getTemporalTrainFraction() {
        return temporalTrainFraction;
    }

    public void setTemporalTrainFraction(double temporalTrainFraction) {
        this.temporalTrainFraction = temporalTrainFraction;
    }

    /**
     * @return seed for shuffling k-fold assignments, or {@code null} to keep
     *         contiguous chronological folds
     */
    public Long getCrossValidationSeed() {
        return crossValidationSeed;
    }

    public void setCrossValidationSeed(Long crossValidationSeed) {
        this.crossValidationSeed = crossValidationSeed;
    }

    public int getWaterYearStartMonth() {
        return waterYearStartMonth;
    }

    public void setWaterYearStartMonth(int waterYearStartMonth) {
        this.waterYearStartMonth = waterYearStartMonth;
    }

    public int getWaterYearStartDay() {
        return waterYearStartDay;
    }

    public void setWaterYearStartDay(int waterYearStartDay) {
        this.waterYearStartDay = waterYearStartDay;
    }

    public ResampleRule getResampleRule() {
        return resampleRule;
    }

    public void setResampleRule(ResampleRule resampleRule) {
        this.resampleRule = resampleRule;
    }

    public AggregationMethod getAggregationMethod() {
        return aggregationMethod;
    }

    public void setAggregationMethod(AggregationMethod aggregationMethod) {
        this.aggregationMethod = aggregationMethod;
    }

    /**
     * @return moving-average window in readings; 1 disables smoothing
     */
    public int getSmoothingWindow() {
        return smoothingWindow;
    }

    public void setSmoothingWindow(int smoothingWindow) {
        this.smoothingWindow = smoothingWindow;
    }

    public boolean isRemoveOutliers() {
        return removeOutliers;
    }

    public void setRemoveOutliers(boolean removeOutliers) {
        this.removeOutliers = removeOutliers;
    }

    public double getOutlierThreshold() {
        return outlierThreshold;
    }

    public void setOutlierThreshold(double outlierThreshold) {
        this.outlierThreshold = outlierThreshold;
    }

    public double getMaxRiseRate() {
        return maxRiseRate;
    }

    public void setMaxRiseRate(double maxRiseRate) {
        this.maxRiseRate = maxRiseRate;
    }

    public double getMinTimeBetweenEvents() {
        return minTimeBetweenEvents;
    }

    public void setMinTimeBetweenEvents(double minTimeBetweenEvents) {
        this.minTimeBetweenEvents = minTimeBetweenEvents;
    }

    public QualityWeights getQualityWeights() {
        return qualityWeights;
    }

    public void setQualityWeights(QualityWeights qualityWeights) {
        this.qualityWeights = qualityWeights;
    }

    /**
     * @return whether cross-validation folds and partition fits may run
     *         concurrently
     */
    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CalculationParameters that))
            return false;
        return Double.compare(specificYield, that.specificYield) == 0
                && Double.compare(threshold, that.threshold) == 0
                && minRecessionLength == that.minRecessionLength
                && Double.compare(fluctuationTolerance, that.fluctuationTolerance) == 0
                && Double.compare(precipitationTolerance, that.precipitationTolerance) == 0
                && postPrecipitationLag == that.postPrecipitationLag
                && antecedentPeriod == that.antecedentPeriod
                && Double.compare(minSegmentQuality, that.minSegmentQuality) == 0
                && polynomialDegree == that.polynomialDegree
                && minSegmentsPerPartition == that.minSegmentsPerPartition
                && Double.compare(minCurveRSquared, that.minCurveRSquared) == 0
                && foldCount == that.foldCount
                && Double.compare(temporalTrainFraction, that.temporalTrainFraction) == 0
                && waterYearStartMonth == that.waterYearStartMonth
                && waterYearStartDay == that.waterYearStartDay
                && smoothingWindow == that.smoothingWindow
                && removeOutliers == that.removeOutliers
                && Double.compare(outlierThreshold, that.outlierThreshold) == 0
                && Double.compare(maxRiseRate, that.maxRiseRate) == 0
                && Double.compare(minTimeBetweenEvents, that.minTimeBetweenEvents) == 0
                && parallel == that.parallel
                && method == that.method
                && curveType == that.curveType
                && seasonalBaseCurveType == that.seasonalBaseCurveType
                && partitionBreakpoints.equals(that.partitionBreakpoints)
                && crossValidationMethod == that.crossValidationMethod
                && Objects.equals(crossValidationSeed, that.crossValidationSeed)
                && resampleRule == that.resampleRule
                && aggregationMethod == that.aggregationMethod
                && Objects.equals(qualityWeights, that.qualityWeights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, specificYield, threshold, minRecessionLength, curveType,
                crossValidationMethod, resampleRule);
    }

    @Override
    public String toString() {
        return "CalculationParameters{" +
                "method=" + method +
                ", specificYield=" + specificYield +
                ", threshold=" + threshold +
                ", minRecessionLength=" + minRecessionLength +
                ", curveType=" + curveType +
                ", crossValidationMethod=" + crossValidationMethod +
                ", resampleRule=" + resampleRule +
                ", smoothingWindow=" + smoothingWindow +
                '}';
    }
}
