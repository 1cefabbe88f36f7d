package com.payment.gateway.core;

/**
 * Base type for every failure raised by the signed-request engine. Transport errors from the
 * HTTP layer are not wrapped and propagate as {@link org.springframework.web.client.RestClientException}.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
