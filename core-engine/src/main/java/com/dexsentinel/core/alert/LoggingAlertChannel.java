package com.dexsentinel.core.alert;

import com.dexsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes alerts to the application log, at a log level matching the alert
 * level.
 *
 * @since 1.0.0
 */
public class LoggingAlertChannel implements AlertChannel {

    public static final String NAME = "log";

    private static final Logger LOG = LoggerFactory.getLogger("com.dexsentinel.alerts");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void deliver(Alert alert) {
        switch (alert.getLevel()) {
            case CRITICAL -> LOG.error("CRITICAL ALERT: {} - {}", alert.getTitle(), alert.getMessage());
            case WARNING -> LOG.warn("ALERT: {} - {}", alert.getTitle(), alert.getMessage());
            default -> LOG.info("INFO: {} - {}", alert.getTitle(), alert.getMessage());
        }
    }
}
