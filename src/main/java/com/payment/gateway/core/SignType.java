package com.payment.gateway.core;

import lombok.Getter;

/**
 * Signature algorithms accepted by the provider. The constant name is the wire value of {@code sign_type}.
 */
@Getter
public enum SignType {

    RSA("SHA1withRSA"),
    RSA2("SHA256withRSA");

    private final String algorithm;

    SignType(String algorithm) {
        this.algorithm = algorithm;
    }
}
