package com.payment.gateway.core;

/**
 * Thrown when an inbound notify does not verify against the provider public key.
 * Callers must treat the notify as forged and skip every fulfillment step.
 */
public class SignatureMismatchException extends GatewayException {

    public SignatureMismatchException(String message) {
        super(message);
    }
}
