package com.rechargeengine.core.fitting;

import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.exception.InsufficientSegmentsException;
import com.rechargeengine.core.exception.ValidationException;
import com.rechargeengine.core.model.CurveType;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RecessionSegment;
import com.rechargeengine.core.model.Season;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Fits a master recession curve to pooled recession segments.
 *
 * <p>
 * Every reading of every segment contributes one point
 * {@code (t, level)} where {@code t} is the number of days since the start of
 * its segment. Single-curve families are fitted by least squares after
 * linearization:
 * </p>
 * <ul>
 * <li>{@link CurveType#EXPONENTIAL}: {@code ln L} on {@code t}</li>
 * <li>{@link CurveType#POWER}: {@code ln L} on {@code ln(t + 0.001)}</li>
 * <li>{@link CurveType#LINEAR}: {@code ln L} on {@code t}, reported as
 * intercept and slope</li>
 * <li>{@link CurveType#POLYNOMIAL}: ordinary least squares on raw levels</li>
 * </ul>
 *
 * <p>
 * {@link CurveType#MULTI_SEGMENT} partitions the segments by the season of
 * their start, or by {@code partitionBreakpoints} when given, and fits
 * {@code seasonalBaseCurveType} to each partition with at least
 * {@code minSegmentsPerPartition} segments. A pooled fit over all segments
 * serves the remaining partitions. Partition fits are independent and run
 * concurrently when {@code parallel} is set.
 * </p>
 *
 * <p>
 * R² is always computed in level space.
 * </p>
 *
 * @since 1.0.0
 */
public class CurveFitter {

    private static final Logger LOG = LoggerFactory.getLogger(CurveFitter.class);

    /** Segments needed for a master curve. */
    public static final int MIN_SEGMENTS = 3;

    /**
     * Fit the configured curve, requiring {@value #MIN_SEGMENTS} segments.
     *
     * @param segments   recession segments in chronological order
     * @param parameters calculation parameters
     * @return fitted curve
     * @throws InsufficientSegmentsException with fewer than {@value #MIN_SEGMENTS}
     *                                       segments
     * @throws ValidationException           when the data cannot be fitted by
     *                                       the chosen family
     */
    public MasterCurve fit(List<RecessionSegment> segments, CalculationParameters parameters) {
        return fit(segments, parameters, MIN_SEGMENTS);
    }

    /**
     * Fit the configured curve with a caller-chosen minimum segment count.
     * Cross-validation refits on training subsets through this method.
     *
     * @param segments        recession segments in chronological order
     * @param parameters      calculation parameters
     * @param minimumSegments fewest segments accepted
     * @return fitted curve
     */
    public MasterCurve fit(List<RecessionSegment> segments, CalculationParameters parameters, int minimumSegments) {
        Objects.requireNonNull(segments, "segments must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        if (segments.size() < minimumSegments) {
            throw new InsufficientSegmentsException(segments.size(), minimumSegments);
        }

        MasterCurve curve = parameters.getCurveType() == CurveType.MULTI_SEGMENT
                ? fitMultiSegment(segments, parameters)
                : fitSingle(parameters.getCurveType(), segments, parameters.getPolynomialDegree()).build();

        LOG.debug("Fitted {} curve to {} segment(s): R²={}", curve.getCurveType(), segments.size(),
                curve.getRSquared());
        return curve;
    }

    // ---------------------------------------------------------------
    // Single curves
    // ---------------------------------------------------------------

    MasterCurve.Builder fitSingle(CurveType type, List<RecessionSegment> segments, int polynomialDegree) {
        PooledPoints points = PooledPoints.of(segments);
        Map<String, Double> parameters = switch (type) {
            case EXPONENTIAL -> fitExponential(points);
            case POWER -> fitPower(points);
            case LINEAR -> fitLogLinear(points);
            case POLYNOMIAL -> fitPolynomial(points, polynomialDegree);
            case MULTI_SEGMENT -> throw new IllegalArgumentException("Not a single-curve type: " + type);
        };

        double[] t = points.elapsedDays();
        double[] predicted = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            predicted[i] = type.evaluate(parameters, t[i]);
        }
        return MasterCurve.builder()
                .curveType(type)
                .parameters(parameters)
                .rSquared(GoodnessOfFit.rSquared(points.levels(), predicted))
                .segmentCount(segments.size())
                .pointCount(points.size());
    }

    private static Map<String, Double> fitExponential(PooledPoints points) {
        SimpleRegression regression = logRegression(points, CurveType.EXPONENTIAL, false);
        Map<String, Double> parameters = new LinkedHashMap<>();
        parameters.put("L0", Math.exp(regression.getIntercept()));
        parameters.put("a", -regression.getSlope());
        return parameters;
    }

    private static Map<String, Double> fitPower(PooledPoints points) {
        SimpleRegression regression = logRegression(points, CurveType.POWER, true);
        Map<String, Double> parameters = new LinkedHashMap<>();
        parameters.put("L0", Math.exp(regression.getIntercept()));
        parameters.put("b", -regression.getSlope());
        return parameters;
    }

    private static Map<String, Double> fitLogLinear(PooledPoints points) {
        SimpleRegression regression = logRegression(points, CurveType.LINEAR, false);
        Map<String, Double> parameters = new LinkedHashMap<>();
        parameters.put("intercept", regression.getIntercept());
        parameters.put("slope", regression.getSlope());
        return parameters;
    }

    private static SimpleRegression logRegression(PooledPoints points, CurveType type, boolean logTime) {
        if (!points.allLevelsPositive()) {
            throw new ValidationException("A " + type + " curve needs strictly positive water levels; "
                    + "use a POLYNOMIAL curve or shift the datum of the series");
        }
        double[] t = points.elapsedDays();
        double[] levels = points.levels();
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < t.length; i++) {
            double x = logTime ? Math.log(t[i] + CurveType.POWER_EPSILON) : t[i];
            regression.addData(x, Math.log(levels[i]));
        }
        if (Double.isNaN(regression.getSlope())) {
            throw new ValidationException("Cannot fit a " + type + " curve: recession points have no spread in time");
        }
        return regression;
    }

    private static Map<String, Double> fitPolynomial(PooledPoints points, int degree) {
        double[] t = points.elapsedDays();
        if (t.length <= degree + 1) {
            throw new ValidationException("A degree-" + degree + " polynomial needs more than " + (degree + 1)
                    + " recession points, got " + t.length);
        }
        double[][] design = new double[t.length][degree];
        for (int i = 0; i < t.length; i++) {
            double power = 1.0;
            for (int d = 0; d < degree; d++) {
                power *= t[i];
                design[i][d] = power;
            }
        }
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        double[] coefficients;
        try {
            regression.newSampleData(points.levels(), design);
            coefficients = regression.estimateRegressionParameters();
        } catch (MathIllegalArgumentException e) {
            throw new ValidationException("Cannot fit a degree-" + degree + " polynomial: " + e.getMessage());
        }
        Map<String, Double> parameters = new LinkedHashMap<>();
        for (int i = 0; i < coefficients.length; i++) {
            parameters.put("c" + i, coefficients[i]);
        }
        return parameters;
    }

    // ---------------------------------------------------------------
    // Multi-segment
    // ---------------------------------------------------------------

    private MasterCurve fitMultiSegment(List<RecessionSegment> segments, CalculationParameters parameters) {
        CurveType base = parameters.getSeasonalBaseCurveType();
        int degree = parameters.getPolynomialDegree();
        List<LocalDate> breakpoints = parameters.breakpointDates();

        Map<String, List<RecessionSegment>> groups = new LinkedHashMap<>();
        for (String label : partitionLabels(breakpoints)) {
            groups.put(label, new ArrayList<>());
        }
        for (RecessionSegment segment : segments) {
            groups.get(MasterCurve.partitionLabel(segment.getStartTimestamp(), breakpoints)).add(segment);
        }

        List<String> fittable = groups.entrySet().stream()
                .filter(e -> e.getValue().size() >= parameters.getMinSegmentsPerPartition())
                .map(Map.Entry::getKey)
                .toList();
        Stream<String> labels = parameters.isParallel() ? fittable.parallelStream() : fittable.stream();
        List<MasterCurve> fitted = labels
                .map(label -> fitSingle(base, groups.get(label), degree)
                        .partitionLabel(label)
                        .season(breakpoints.isEmpty() ? Season.valueOf(label) : null)
                        .build())
                .toList();

        Map<String, MasterCurve> partitions = new LinkedHashMap<>();
        for (MasterCurve partition : fitted) {
            partitions.put(partition.getPartitionLabel(), partition);
            LOG.debug("Partition {}: {} segment(s), R²={}", partition.getPartitionLabel(),
                    partition.getSegmentCount(), partition.getRSquared());
        }
        if (partitions.size() < groups.size()) {
            LOG.info("{} of {} partition(s) have fewer than {} segment(s) and use the pooled fallback curve",
                    groups.size() - partitions.size(), groups.size(), parameters.getMinSegmentsPerPartition());
        }

        MasterCurve fallback = fitSingle(base, segments, degree).build();
        MasterCurve.Builder multi = MasterCurve.builder()
                .curveType(CurveType.MULTI_SEGMENT)
                .baseCurveType(base)
                .parameters(fallback.getParameters())
                .partitions(partitions)
                .breakpoints(breakpoints.isEmpty() ? null : breakpoints)
                .segmentCount(segments.size())
                .pointCount(fallback.getPointCount());
        // R² needs the partition lookup, so score a first build and rebuild with it
        double rSquared = GoodnessOfFit.rSquared(multi.build(), segments);
        return multi.rSquared(rSquared).build();
    }

    private static List<String> partitionLabels(List<LocalDate> breakpoints) {
        List<String> labels = new ArrayList<>();
        if (breakpoints.isEmpty()) {
            for (Season season : Season.values()) {
                labels.add(season.name());
            }
        } else {
            for (int i = 0; i <= breakpoints.size(); i++) {
                labels.add(MasterCurve.PERIOD_LABEL_PREFIX + i);
            }
        }
        return labels;
    }
}
