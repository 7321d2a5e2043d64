/**
 * Recharge event detection.
 *
 * <p>
 * All detectors implement
 * {@link com.rechargeengine.core.detection.RechargeEventDetector} and are
 * created per calculation by
 * {@link com.rechargeengine.core.detection.DetectorFactory}:
 * </p>
 * <ul>
 * <li>{@link com.rechargeengine.core.detection.RiseEventDetector}: rise above
 * the antecedent recession (RISE)</li>
 * <li>{@link com.rechargeengine.core.detection.CurveDeviationDetector}:
 * deviation above the anchored master curve (MRC, ERC)</li>
 * </ul>
 *
 * <p>
 * {@link com.rechargeengine.core.detection.EventQualityScorer} adds quality
 * scores to ERC events.
 * </p>
 *
 * @since 1.0.0
 */
package com.rechargeengine.core.detection;
