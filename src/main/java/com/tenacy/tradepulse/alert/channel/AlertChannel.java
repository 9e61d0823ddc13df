package com.tenacy.tradepulse.alert.channel;

import com.tenacy.tradepulse.alert.AlertMessage;
import com.tenacy.tradepulse.domain.AlertSeverity;

/**
 * Outbound alert transport.
 */
public interface AlertChannel {

    /**
     * Name used in the alert document ({@code slack}, {@code telegram}, {@code email}).
     */
    String getName();

    /**
     * @throws com.tenacy.tradepulse.exception.AlertDeliveryException when the message was not delivered
     */
    void send(AlertMessage message, AlertSeverity severity);
}
