package com.payment.gateway.core;

import lombok.Value;

/**
 * Address of the open API gateway, e.g. {@code https://openapi.alipay.com}.
 */
@Value
public class GatewayEndpoint {

    String gatewayUrl;

    public String getRequestUrl() {
        String base = gatewayUrl.endsWith("/") ? gatewayUrl.substring(0, gatewayUrl.length() - 1) : gatewayUrl;
        return base + "/gateway.do?charset=UTF-8";
    }
}
