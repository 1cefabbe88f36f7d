package com.payment.gateway.core;

import com.payment.gateway.domain.Auxiliary;
import com.payment.gateway.domain.Notify;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Confirms a payment whose first response was not definitive by querying the trade until it
 * is paid or the {@link PollingPolicy} runs out, then cancels the trade so a late buyer
 * confirmation cannot complete a payment the caller already gave up on.
 * <p>
 * Attempts run one after another on the calling thread and never overlap the cancel. A query
 * that fails in transport or with a non-success code ends the poll with that exception.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentPoller {

    public static final String TIMEOUT_MESSAGE = "Payment timed out";

    private final CommitCycle commitCycle;
    private final PollingPolicy policy;
    private final Sleeper sleeper;

    public PollResult poll(String tradeNo) {
        Auxiliary auxiliary = Auxiliary.builder().tradeNo(tradeNo).build();
        int maxAttempts = policy.getMaxAttempts();
        Notify last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                pause(policy.delayAfter(attempt - 1));
            }
            last = commitCycle.commit(GatewayMethod.QUERY, auxiliary);
            log.debug("Poll attempt {}/{} tradeNo={} tradeStatus={}", attempt, maxAttempts, tradeNo, last.getTradeStatus());
            if (GatewayConstants.isPaid(last.getTradeStatus())) {
                log.info("Payment confirmed by polling: tradeNo={}, attempts={}", tradeNo, attempt);
                return PollResult.builder()
                        .state(PollResult.State.SUCCEEDED)
                        .attempts(attempt)
                        .notify(last)
                        .build();
            }
        }

        log.warn("Payment not confirmed after {} attempts, cancelling tradeNo={}", maxAttempts, tradeNo);
        PollResult.PollResultBuilder result = PollResult.builder()
                .state(PollResult.State.TIMED_OUT)
                .attempts(maxAttempts)
                .notify(last);
        try {
            Notify cancelled = commitCycle.commit(GatewayMethod.CANCEL, auxiliary);
            log.info("Cancelled timed-out trade: tradeNo={}, action={}", tradeNo, cancelled.getAction());
            result.cancelled(true);
        } catch (RuntimeException e) {
            // The timeout is what the caller sees; a failed cancel is left for reconciliation.
            log.error("Cancel after poll timeout failed for tradeNo={}", tradeNo, e);
            result.cancelFailure(e);
        }
        return result.build();
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("Payment polling interrupted", e);
        }
    }
}
