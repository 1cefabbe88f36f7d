package com.payment.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Alipay gateway service. Exposes:
 * <ul>
 *   <li>Payment initiation for web, mobile web, app, mini-program, QR and barcode modes</li>
 *   <li>Trade query, cancel, close, refund and bill download</li>
 *   <li>The asynchronous notify callback, verified before it is trusted</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class AlipayGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlipayGatewayApplication.class, args);
    }
}
