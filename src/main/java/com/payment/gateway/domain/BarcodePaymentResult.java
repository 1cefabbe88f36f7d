package com.payment.gateway.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Result of an in-person barcode payment after any confirmation polling.
 */
@Value
@Builder
public class BarcodePaymentResult {

    PaymentOutcome outcome;
    String outTradeNo;
    String tradeNo;
    /** Provider sub-message on failure, the fixed timeout message on timeout. */
    String message;
    /** Query attempts made while polling; 0 when the first response was definitive. */
    int pollAttempts;
    /** Last notify seen: the pay response or the last query response. */
    Notify notify;

    public boolean isSucceeded() {
        return outcome == PaymentOutcome.SUCCEEDED;
    }
}
