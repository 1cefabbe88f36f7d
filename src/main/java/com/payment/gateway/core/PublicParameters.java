package com.payment.gateway.core;

import lombok.Builder;
import lombok.Value;

/**
 * Common request parameters of every open API call. Properties are declared in the
 * lexical order of their wire names, which is the order the provider canonicalizes in.
 */
@Value
@Builder
public class PublicParameters {

    String appId;
    String bizContent;
    String charset;
    String format;
    String method;
    String notifyUrl;
    String returnUrl;
    String signType;
    String timestamp;
    String version;
}
