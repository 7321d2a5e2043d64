package com.rechargeengine.core.validation;

import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.fitting.CurveFitter;
import com.rechargeengine.core.fitting.GoodnessOfFit;
import com.rechargeengine.core.model.CrossValidationMethod;
import com.rechargeengine.core.model.CrossValidationResult;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RecessionSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Estimates how well a master recession curve generalizes to recessions it
 * was not fitted on.
 *
 * <h3>Splits</h3>
 * <ul>
 * <li>{@link CrossValidationMethod#K_FOLD}: {@code foldCount} (clamped to the
 * number of segments) contiguous chronological blocks of nearly equal size.
 * With a {@code crossValidationSeed} the segment order is shuffled
 * reproducibly before blocking.</li>
 * <li>{@link CrossValidationMethod#LEAVE_ONE_OUT}: one fold per segment.</li>
 * <li>{@link CrossValidationMethod#TEMPORAL_SPLIT}: a single fold training on
 * the earliest {@code temporalTrainFraction} of the segments, keeping at
 * least one segment on each side.</li>
 * </ul>
 *
 * <p>
 * Each fold refits the configured curve on its training segments and scores
 * R² on the held-out readings. Folds share no state, so they run concurrently
 * when {@code parallel} is set; results are always reported in fold order.
 * </p>
 *
 * @since 1.0.0
 */
public class CrossValidator {

    private static final Logger LOG = LoggerFactory.getLogger(CrossValidator.class);

    private final CurveFitter fitter;

    public CrossValidator(CurveFitter fitter) {
        this.fitter = Objects.requireNonNull(fitter, "fitter must not be null");
    }

    /**
     * Cross-validate the curve family configured in {@code parameters}.
     *
     * @param segments   all recession segments, chronological
     * @param fullCurve  curve fitted on all segments
     * @param parameters calculation parameters
     * @return per-fold and mean validation R²
     */
    public CrossValidationResult validate(List<RecessionSegment> segments, MasterCurve fullCurve,
            CalculationParameters parameters) {
        Objects.requireNonNull(segments, "segments must not be null");
        Objects.requireNonNull(fullCurve, "fullCurve must not be null");
        if (segments.size() < 2) {
            throw new IllegalArgumentException("Cross-validation needs at least 2 segments, got " + segments.size());
        }

        List<List<Integer>> holdOuts = holdOutIndices(segments.size(), parameters);
        IntStream folds = IntStream.range(0, holdOuts.size());
        if (parameters.isParallel()) {
            folds = folds.parallel();
        }
        List<Fold> results = folds
                .mapToObj(i -> runFold(segments, holdOuts.get(i), parameters))
                .toList();

        List<Double> foldRSquared = new ArrayList<>(results.size());
        List<MasterCurve> foldCurves = new ArrayList<>(results.size());
        for (Fold fold : results) {
            foldRSquared.add(fold.rSquared);
            foldCurves.add(fold.curve);
        }
        double mean = foldRSquared.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        CrossValidationResult result = new CrossValidationResult(parameters.getCrossValidationMethod(),
                foldRSquared, mean, fullCurve.getRSquared(), foldCurves);
        if (result.isDegraded()) {
            LOG.warn("Cross-validated R² {} is well below full-data R² {}; the curve may be overfitted",
                    mean, fullCurve.getRSquared());
        } else {
            LOG.info("Cross-validation ({}, {} fold(s)): mean R²={}", parameters.getCrossValidationMethod(),
                    results.size(), mean);
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Splitting
    // ---------------------------------------------------------------

    /**
     * Indices of the held-out segments of every fold, in fold order.
     *
     * @param segmentCount number of segments (at least 2)
     * @param parameters   calculation parameters
     * @return held-out index lists
     */
    static List<List<Integer>> holdOutIndices(int segmentCount, CalculationParameters parameters) {
        return switch (parameters.getCrossValidationMethod()) {
            case K_FOLD -> kFold(segmentCount, parameters.getFoldCount(), parameters.getCrossValidationSeed());
            case LEAVE_ONE_OUT -> kFold(segmentCount, segmentCount, null);
            case TEMPORAL_SPLIT -> temporalSplit(segmentCount, parameters.getTemporalTrainFraction());
        };
    }

    private static List<List<Integer>> kFold(int segmentCount, int requestedFolds, Long seed) {
        int folds = Math.min(requestedFolds, segmentCount);
        List<Integer> order = new ArrayList<>(segmentCount);
        for (int i = 0; i < segmentCount; i++) {
            order.add(i);
        }
        if (seed != null) {
            Collections.shuffle(order, new Random(seed));
        }
        List<List<Integer>> holdOuts = new ArrayList<>(folds);
        int base = segmentCount / folds;
        int remainder = segmentCount % folds;
        int start = 0;
        for (int f = 0; f < folds; f++) {
            int size = base + (f < remainder ? 1 : 0);
            List<Integer> block = new ArrayList<>(order.subList(start, start + size));
            Collections.sort(block);
            holdOuts.add(block);
            start += size;
        }
        return holdOuts;
    }

    private static List<List<Integer>> temporalSplit(int segmentCount, double trainFraction) {
        int train = (int) Math.round(segmentCount * trainFraction);
        train = Math.max(1, Math.min(segmentCount - 1, train));
        List<Integer> validation = new ArrayList<>();
        for (int i = train; i < segmentCount; i++) {
            validation.add(i);
        }
        return List.of(validation);
    }

    // ---------------------------------------------------------------
    // Folds
    // ---------------------------------------------------------------

    private Fold runFold(List<RecessionSegment> segments, List<Integer> holdOut, CalculationParameters parameters) {
        List<RecessionSegment> training = new ArrayList<>();
        List<RecessionSegment> validation = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            (holdOut.contains(i) ? validation : training).add(segments.get(i));
        }
        MasterCurve curve = fitter.fit(training, parameters, 1);
        double rSquared = GoodnessOfFit.rSquared(curve, validation);
        LOG.debug("Fold holding out segment(s) {}: R²={}", holdOut, rSquared);
        return new Fold(curve, rSquared);
    }

    private static final class Fold {
        private final MasterCurve curve;
        private final double rSquared;

        private Fold(MasterCurve curve, double rSquared) {
            this.curve = curve;
            this.rSquared = rSquared;
        }
    }
}
