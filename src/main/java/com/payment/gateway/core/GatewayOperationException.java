package com.payment.gateway.core;

import lombok.Getter;

/**
 * Thrown when the provider answers a commit with a result code other than the success code.
 * The exception message is the provider's sub-message, verbatim.
 */
@Getter
public class GatewayOperationException extends GatewayException {

    private final String code;
    private final String subCode;

    public GatewayOperationException(String code, String subCode, String subMessage) {
        super(subMessage);
        this.code = code;
        this.subCode = subCode;
    }
}
