package com.payment.gateway.core;

/**
 * Thrown when a response body or notify cannot be read into the expected object shape.
 */
public class MalformedResponseException extends GatewayException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
