/**
 * Runnable Dex Sentinel pipeline: environment configuration, seed import,
 * alert file channel and export, and the HTTP surface over the core engine.
 *
 * @since 1.0.0
 */
package com.dexsentinel.app;
