/**
 * Domain model classes for Dex Sentinel.
 *
 * <p>
 * This package contains the immutable values exchanged between the rule
 * engine, the stream processor, the alert system and the dashboard:
 * </p>
 * <ul>
 * <li>{@link com.dexsentinel.core.model.CreatureRecord}: catalog record with
 * its {@link com.dexsentinel.core.model.StatBlock}</li>
 * <li>{@link com.dexsentinel.core.model.AnomalyFinding}: one rule
 * violation</li>
 * <li>{@link com.dexsentinel.core.model.StreamEvent}: outcome of processing
 * one record</li>
 * <li>{@link com.dexsentinel.core.model.Alert}: leveled notification</li>
 * <li>{@link com.dexsentinel.core.model.OperationResult}: success/failure
 * indicator with a {@link com.dexsentinel.core.model.Reason}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.dexsentinel.core.model;
