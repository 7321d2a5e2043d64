package com.rechargeengine.core.model;

import java.util.List;
import java.util.Map;

/**
 * Master recession curve families.
 *
 * <p>
 * Every single-curve family is a pure function pair: the fitter produces a
 * parameter map and {@link #evaluate(Map, double)} turns that map back into a
 * level at {@code t} days after recession onset. {@link #MULTI_SEGMENT} has no
 * formula of its own; it is a set of partition curves selected by season or
 * period at evaluation time (see {@link MasterCurve#curveFor(java.time.LocalDateTime)}).
 * </p>
 *
 * @since 1.0.0
 */
public enum CurveType {

    /** {@code L = L0 * e^(-a t)}. */
    EXPONENTIAL(List.of("L0", "a")) {
        @Override
        public double evaluate(Map<String, Double> p, double t) {
            return p.get("L0") * Math.exp(-p.get("a") * t);
        }
    },

    /** {@code L = L0 * (t + eps)^(-b)}. */
    POWER(List.of("L0", "b")) {
        @Override
        public double evaluate(Map<String, Double> p, double t) {
            return p.get("L0") * Math.pow(t + POWER_EPSILON, -p.get("b"));
        }

        @Override
        public double anchorReferenceDays() {
            return POWER_ANCHOR_REFERENCE_DAYS;
        }
    },

    /** {@code ln L = intercept + slope * t}. */
    LINEAR(List.of("intercept", "slope")) {
        @Override
        public double evaluate(Map<String, Double> p, double t) {
            return Math.exp(p.get("intercept") + p.get("slope") * t);
        }
    },

    /** {@code L = c0 + c1 t + ... + cn t^n}, degree 2 to 4. */
    POLYNOMIAL(List.of("c0", "c1", "c2")) {
        @Override
        public double evaluate(Map<String, Double> p, double t) {
            double value = 0.0;
            double power = 1.0;
            for (int i = 0; p.containsKey("c" + i); i++) {
                value += p.get("c" + i) * power;
                power *= t;
            }
            return value;
        }

        @Override
        public boolean isMultiplicative() {
            return false;
        }
    },

    /** Independent curves per season or period. */
    MULTI_SEGMENT(List.of()) {
        @Override
        public double evaluate(Map<String, Double> p, double t) {
            throw new UnsupportedOperationException(
                    "Multi-segment curves are evaluated through their partition curves");
        }
    };

    /** Offset that keeps the power law finite at {@code t = 0}. */
    public static final double POWER_EPSILON = 0.001;

    /**
     * Anchor reference of the power law. Its value at {@code t = 0} sits on the
     * {@link #POWER_EPSILON} singularity and is not a usable onset level.
     */
    public static final double POWER_ANCHOR_REFERENCE_DAYS = 1.0;

    private final List<String> parameterNames;

    CurveType(List<String> parameterNames) {
        this.parameterNames = parameterNames;
    }

    /**
     * Evaluate the curve.
     *
     * @param parameters fitted parameters, keyed by name
     * @param t          days since recession onset
     * @return predicted water level
     */
    public abstract double evaluate(Map<String, Double> parameters, double t);

    /**
     * Whether the family scales with its starting level, so that a curve can
     * be re-anchored by ratio rather than by offset.
     *
     * @return {@code true} for exponential, power and log-linear curves
     */
    public boolean isMultiplicative() {
        return true;
    }

    /**
     * Time since onset at which a re-anchored curve equals the anchor level.
     * Before this point the anchored curve is held at the anchor.
     *
     * @return reference time in days; 0 unless the formula is singular at onset
     */
    public double anchorReferenceDays() {
        return 0.0;
    }

    /**
     * @return the minimal parameter names (polynomials may add higher terms)
     */
    public List<String> getParameterNames() {
        return parameterNames;
    }
}
