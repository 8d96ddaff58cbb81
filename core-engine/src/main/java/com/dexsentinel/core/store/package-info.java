/**
 * Record store contract consumed by the core, with an in-memory
 * implementation.
 *
 * @since 1.0.0
 */
package com.dexsentinel.core.store;
