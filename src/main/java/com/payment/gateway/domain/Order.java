package com.payment.gateway.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One payment intent. Serialized in snake case as the {@code biz_content} of payment calls.
 */
@Value
@Builder(toBuilder = true)
public class Order {

    /** Amount in yuan, two decimals. */
    BigDecimal totalAmount;

    String subject;

    /** Merchant order number, unique per merchant. */
    String outTradeNo;

    /** Product code; set by the payment mode. */
    String productCode;

    String body;

    /** Relative expiry such as {@code 90m}. */
    String timeoutExpress;

    /** Buyer's payment code, barcode payments only. */
    String authCode;

    /** Barcode scene, {@code bar_code} unless overridden. */
    String scene;

    /** Page to return to when a WAP payment is abandoned. */
    String quitUrl;
}
