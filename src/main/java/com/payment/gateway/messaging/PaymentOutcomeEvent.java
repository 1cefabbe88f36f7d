package com.payment.gateway.messaging;

import com.payment.gateway.domain.PaymentOutcome;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Published whenever a payment reaches a terminal outcome, either at the end of a barcode
 * payment or when an authenticated notify reports it. Listeners fulfil or release the order.
 */
@Value
@Builder
@Jacksonized
public class PaymentOutcomeEvent {

    String eventId;
    String outTradeNo;
    String tradeNo;
    PaymentOutcome outcome;
    String tradeStatus;
    String totalAmount;
    String message;
    /** BARCODE or NOTIFY. */
    String source;
    Instant timestamp;
}
