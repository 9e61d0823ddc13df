package com.tenacy.tradepulse.exception;

/**
 * Raised by an alert channel when a message could not be delivered.
 */
public class AlertDeliveryException extends RuntimeException {

    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
