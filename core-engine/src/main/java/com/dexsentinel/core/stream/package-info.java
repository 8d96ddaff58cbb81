/**
 * Stream processing of catalog records.
 *
 * <p>
 * The {@link com.dexsentinel.core.stream.StreamProcessor} owns the
 * RUNNING/STOPPED lifecycle, the lifetime counters and a
 * {@link com.dexsentinel.core.stream.BoundedLog} of recent events. Findings
 * are forwarded to the {@link com.dexsentinel.core.alert.AlertSystem} after
 * the processor's lock has been released.
 * </p>
 *
 * @since 1.0.0
 */
package com.dexsentinel.core.stream;
