/**
 * Master recession curve fitting.
 *
 * <p>
 * {@link com.rechargeengine.core.fitting.CurveFitter} linearizes each curve
 * family and fits it by least squares with Apache Commons Math;
 * {@link com.rechargeengine.core.fitting.GoodnessOfFit} scores curves in level
 * space.
 * </p>
 *
 * @since 1.0.0
 */
package com.rechargeengine.core.fitting;
