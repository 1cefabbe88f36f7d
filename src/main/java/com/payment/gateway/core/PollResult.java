package com.payment.gateway.core;

import com.payment.gateway.domain.Notify;
import lombok.Builder;
import lombok.Value;

/**
 * Where a confirmation poll ended.
 */
@Value
@Builder
public class PollResult {

    public enum State {
        SUCCEEDED,
        /** Attempts exhausted; a cancel was issued for the trade. */
        TIMED_OUT
    }

    State state;
    int attempts;
    /** Last query response. */
    Notify notify;
    /** Whether the compensating cancel was accepted by the provider. */
    boolean cancelled;
    /** Why the compensating cancel failed, if it did. */
    RuntimeException cancelFailure;

    public boolean isSucceeded() {
        return state == State.SUCCEEDED;
    }
}
