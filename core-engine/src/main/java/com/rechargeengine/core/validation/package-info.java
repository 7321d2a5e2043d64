/**
 * Cross-validation of master recession curves.
 */
package com.rechargeengine.core.validation;
