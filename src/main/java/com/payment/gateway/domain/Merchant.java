package com.payment.gateway.domain;

import com.payment.gateway.core.SignType;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Merchant credentials and call defaults, built once from configuration.
 * The open API method and business payload are per-call inputs of the commit cycle, not state here.
 */
@Value
@Builder
public class Merchant {

    /** Application id issued by the open platform. */
    String appId;

    /** PKCS#8 Base64 private key used to sign requests. */
    @ToString.Exclude
    String privateKey;

    /** X.509 Base64 provider public key used to verify notifies. */
    @ToString.Exclude
    String alipayPublicKey;

    @Builder.Default
    SignType signType = SignType.RSA2;

    @Builder.Default
    String charset = "UTF-8";

    @Builder.Default
    String format = "JSON";

    @Builder.Default
    String version = "1.0";

    /** Callback the provider pushes asynchronous notifies to. */
    String notifyUrl;

    /** Page the buyer returns to after a form or URL payment. */
    String returnUrl;
}
