package com.payment.gateway.domain;

/**
 * Terminal outcome of a payment attempt as reported to listeners.
 */
public enum PaymentOutcome {
    SUCCEEDED,
    FAILED,
    /** Confirmation polling ran out of attempts; the trade was cancelled. */
    TIMED_OUT
}
