/**
 * Loading and validation of the YAML anomaly-rule configuration.
 *
 * <p>
 * {@link com.dexsentinel.core.config.RulesLoader} parses the rule file into a
 * {@link com.dexsentinel.core.config.RulesConfig} and validates it before
 * returning, so a broken rule file stops the application at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.dexsentinel.core.config;
