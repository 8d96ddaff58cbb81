package com.dexsentinel.core.alert;

import com.dexsentinel.core.model.Alert;

import java.io.IOException;

/**
 * Destination an accepted alert is delivered to.
 *
 * <p>
 * Delivery happens after the alert has been added to the history and outside
 * the alert system's lock. A failing channel is logged by the alert system
 * and does not affect other channels or the history.
 * </p>
 */
public interface AlertChannel {

    /**
     * @return unique channel name, e.g. {@code "log"} or {@code "file"}
     */
    String name();

    void deliver(Alert alert) throws IOException;
}
