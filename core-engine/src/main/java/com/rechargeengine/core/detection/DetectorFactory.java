package com.rechargeengine.core.detection;

import com.rechargeengine.core.config.CalculationParameters;
import com.rechargeengine.core.model.MasterCurve;
import com.rechargeengine.core.model.RecessionSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates the {@link RechargeEventDetector} for a calculation method.
 *
 * <p>
 * The rise method needs antecedent baselines; the curve methods need the
 * master curve and the segments it was fitted on. Inputs a method does not
 * use may be {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * @param parameters         calculation parameters; selects the method
     * @param antecedentBaselines per-reading baselines (RISE)
     * @param curve              master curve (MRC, ERC)
     * @param segments           recession segments (MRC, ERC)
     * @return a fresh detector for one pass over one series
     * @throws NullPointerException if an input the method needs is missing
     */
    public static RechargeEventDetector create(CalculationParameters parameters, double[] antecedentBaselines,
            MasterCurve curve, List<RecessionSegment> segments) {
        Objects.requireNonNull(parameters, "parameters must not be null");
        Objects.requireNonNull(parameters.getMethod(), "method must not be null");

        RechargeEventDetector detector = switch (parameters.getMethod()) {
            case RISE -> new RiseEventDetector(parameters,
                    Objects.requireNonNull(antecedentBaselines, "RISE needs antecedent baselines"));
            case MRC, ERC -> new CurveDeviationDetector(parameters,
                    Objects.requireNonNull(curve, parameters.getMethod() + " needs a master curve"),
                    Objects.requireNonNull(segments, parameters.getMethod() + " needs recession segments"));
        };
        LOG.debug("Created {} for method {}", detector.getClass().getSimpleName(), detector.getMethodName());
        return detector;
    }
}
