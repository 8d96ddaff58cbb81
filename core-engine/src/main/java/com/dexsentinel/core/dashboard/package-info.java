/**
 * On-demand dashboard summary: data-quality score, catalog statistics and
 * processing counters.
 *
 * @since 1.0.0
 */
package com.dexsentinel.core.dashboard;
