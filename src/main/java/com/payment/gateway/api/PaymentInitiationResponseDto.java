package com.payment.gateway.api;

import lombok.Builder;
import lombok.Value;

/**
 * What the client needs to complete a payment: an HTML form, a redirect URL, an SDK order
 * string or a QR code, depending on {@code mode}.
 */
@Value
@Builder
public class PaymentInitiationResponseDto {

    String outTradeNo;
    /** FORM, URL, APP, APPLET or SCAN. */
    String mode;
    String payload;
}
