package com.payment.gateway.core;

import lombok.Builder;
import lombok.Value;

/**
 * An arbitrary open API call for {@link CommitCycle#execute(GatewayRequest)}: any method, any
 * business payload, materialized as any result type. The result object is read from the
 * envelope field {@code responseKey} or, when that is not set, from the first field other than
 * {@code sign}.
 *
 * @param <T> result type, read from snake-case fields
 */
@Value
@Builder
public class GatewayRequest<T> {

    String method;
    /** Business payload; a bean is serialized in snake case, a string is sent as-is. */
    Object bizContent;
    Class<T> responseType;
    /** Envelope field holding the result; optional. */
    String responseKey;

    public static <T> GatewayRequest<T> of(String method, Object bizContent, Class<T> responseType) {
        return GatewayRequest.<T>builder()
                .method(method)
                .bizContent(bizContent)
                .responseType(responseType)
                .build();
    }
}
