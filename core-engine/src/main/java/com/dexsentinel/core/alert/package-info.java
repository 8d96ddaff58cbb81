/**
 * Alert classification, bounded history and delivery.
 *
 * <p>
 * {@link com.dexsentinel.core.alert.AlertSystem} maps finding severities to
 * alert levels, retains the most recent alerts and forwards each accepted
 * alert to its {@link com.dexsentinel.core.alert.AlertChannel}s.
 * </p>
 *
 * @since 1.0.0
 */
package com.dexsentinel.core.alert;
