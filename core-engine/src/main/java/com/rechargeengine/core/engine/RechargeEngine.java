package com.rechargeengine.core.engine;

import com.rechargeengine.core.aggregation.Aggregation;
import com.rechargeengine.core.aggregation.Aggregator;
import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.detection.DetectorFactory;
import com.rechargeengine.core.detection.EventQualityScorer;
import com.rechargeengine.core.detection.RechargeEventDetector;
import com.rechargeengine.core.exception.EmptySeriesException;
import com.rechargeengine.core.exception.InsufficientSegmentsException;
import com.rechargeengine.core.exception.ValidationException;
import com.rechargeengine.core.fitting.CurveFitter;
import com.rechargeengine.core.model.CalculationResult;
import com.rechargeengine.core.model.CrossValidationResult;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RechargeEvent;
import com.rechargeengine.core.model.RechargeMethod;
import com.rechargeengine.core.model.RecessionSegment;
import com.rechargeengine.core.model.TimeSeries;
import com.rechargeengine.core.preprocess.TimeSeriesPreprocessor;
import com.rechargeengine.core.segment.SegmentIdentifier;
import com.rechargeengine.core.validation.CrossValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Entry point of the recharge calculation.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>{@link TimeSeriesPreprocessor}: clean, resample, smooth, label water
 * years.</li>
 * <li>{@link SegmentIdentifier}: recession segments (MRC, ERC) or antecedent
 * baselines (RISE).</li>
 * <li>{@link CurveFitter}: master recession curve (MRC, ERC).</li>
 * <li>{@link CrossValidator}: fold-wise validation of the curve (ERC).</li>
 * <li>{@link RechargeEventDetector}: recharge events, scored by
 * {@link EventQualityScorer} for ERC.</li>
 * <li>{@link Aggregator}: water-year and seasonal totals.</li>
 * <li>{@link ResultAssembler}: the immutable result and quality report.</li>
 * </ol>
 *
 * <p>
 * A run reads only its own series and a private copy of the parameters, so a
 * single engine may serve concurrent calculations. Data-quality problems
 * become warnings on the result; only invalid input and too few recession
 * segments for a curve abort the run.
 * </p>
 *
 * @since 1.0.0
 */
public class RechargeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RechargeEngine.class);

    static final double MIN_RISE_RECORD_DAYS = 30.0;
    static final double MIN_ERC_RECORD_DAYS = 365.0;
    static final int MRC_RECORD_MULTIPLE = 3;

    private final TimeSeriesPreprocessor preprocessor;
    private final SegmentIdentifier segmentIdentifier;
    private final CurveFitter curveFitter;
    private final CrossValidator crossValidator;
    private final Aggregator aggregator;
    private final ResultAssembler assembler;

    public RechargeEngine() {
        this(new TimeSeriesPreprocessor(), new SegmentIdentifier(), new CurveFitter(), new Aggregator(),
                new ResultAssembler());
    }

    RechargeEngine(TimeSeriesPreprocessor preprocessor, SegmentIdentifier segmentIdentifier, CurveFitter curveFitter,
            Aggregator aggregator, ResultAssembler assembler) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor must not be null");
        this.segmentIdentifier = Objects.requireNonNull(segmentIdentifier, "segmentIdentifier must not be null");
        this.curveFitter = Objects.requireNonNull(curveFitter, "curveFitter must not be null");
        this.crossValidator = new CrossValidator(curveFitter);
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
    }

    /**
     * Run a full calculation.
     *
     * @param series     raw water-level series
     * @param parameters calculation parameters; validated and copied
     * @return the result
     * @throws ValidationException           if a parameter is invalid or the
     *                                       data cannot be fitted
     * @throws EmptySeriesException          if no reading survives
     *                                       preprocessing
     * @throws InsufficientSegmentsException if one or two recession segments
     *                                       are found where a curve needs three
     */
    public CalculationResult calculate(TimeSeries series, CalculationParameters parameters) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        parameters.validate();
        CalculationParameters snapshot = parameters.copy();
        RechargeMethod method = snapshot.getMethod();

        LOG.info("Starting {} calculation on {} reading(s)", method, series.size());
        TimeSeries processed = preprocessor.process(series, snapshot);
        List<String> warnings = new ArrayList<>();
        checkRecordLength(processed, snapshot, warnings);

        List<RecessionSegment> segments = List.of();
        MasterCurve curve = null;
        CrossValidationResult crossValidation = null;
        List<RechargeEvent> events;

        if (method == RechargeMethod.RISE) {
            double[] baselines = segmentIdentifier.antecedentBaselines(processed, snapshot);
            events = DetectorFactory.create(snapshot, baselines, null, null).detectAll(processed);
        } else {
            segments = segmentIdentifier.identify(processed, snapshot);
            if (segments.isEmpty()) {
                warn(warnings, "No recession segments were found; relax minRecessionLength ("
                        + snapshot.getMinRecessionLength() + " days) or fluctuationTolerance ("
                        + snapshot.getFluctuationTolerance() + " ft) to fit a recession curve");
                events = List.of();
            } else {
                curve = curveFitter.fit(segments, snapshot);
                if (curve.getRSquared() < snapshot.getMinCurveRSquared()) {
                    warn(warnings, String.format(Locale.ROOT,
                            "Master curve R² %.3f is below %.2f; recharge estimates may be unreliable",
                            curve.getRSquared(), snapshot.getMinCurveRSquared()));
                }
                if (method == RechargeMethod.ERC) {
                    crossValidation = crossValidator.validate(segments, curve, snapshot);
                    if (crossValidation.isDegraded()) {
                        warn(warnings, String.format(Locale.ROOT,
                                "Cross-validated R² %.3f is more than %.1f below the full-data R² %.3f; "
                                        + "the curve may be overfitted",
                                crossValidation.getMeanRSquared(), CrossValidationResult.DEGRADATION_MARGIN,
                                crossValidation.getFullDataRSquared()));
                    }
                }
                RechargeEventDetector detector = DetectorFactory.create(snapshot, null, curve, segments);
                events = detector.detectAll(processed);
                if (method == RechargeMethod.ERC) {
                    events = new EventQualityScorer(snapshot.getQualityWeights(), snapshot.getThreshold())
                            .score(events, segments, crossValidation);
                }
            }
        }

        boolean noSegments = method.usesRecessionCurve() && segments.isEmpty();
        if (events.isEmpty() && !noSegments) {
            warn(warnings, "No recharge events exceeded the threshold of " + snapshot.getThreshold() + " ft");
        }

        Aggregation aggregation = aggregator.aggregate(events, processed, method, curve);
        CalculationResult result = assembler.assemble(snapshot, segments, curve, crossValidation, events,
                aggregation, warnings);
        LOG.info("Finished {} calculation: {} event(s), total recharge {} in, {} warning(s)", method,
                events.size(), result.getTotalRecharge(), warnings.size());
        return result;
    }

    private static void checkRecordLength(TimeSeries processed, CalculationParameters parameters,
            List<String> warnings) {
        double required = switch (parameters.getMethod()) {
            case RISE -> MIN_RISE_RECORD_DAYS;
            case MRC -> MRC_RECORD_MULTIPLE * parameters.getMinRecessionLength();
            case ERC -> MIN_ERC_RECORD_DAYS;
        };
        double span = processed.spanDays();
        if (span < required) {
            warn(warnings, String.format(Locale.ROOT,
                    "Record spans %.1f days; %s results are more reliable with at least %.0f days",
                    span, parameters.getMethod(), required));
        }
    }

    private static void warn(List<String> warnings, String message) {
        LOG.warn(message);
        warnings.add(message);
    }
}
