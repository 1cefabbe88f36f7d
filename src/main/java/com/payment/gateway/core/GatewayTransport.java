package com.payment.gateway.core;

/**
 * Blocking HTTP boundary of the engine. Implementations propagate transport failures
 * unchanged; the engine never retries them.
 */
public interface GatewayTransport {

    /**
     * POSTs an {@code application/x-www-form-urlencoded} body and returns the response text.
     */
    String post(String url, String formBody);

    /**
     * GETs a binary resource, such as a statement archive.
     */
    byte[] download(String url);
}
