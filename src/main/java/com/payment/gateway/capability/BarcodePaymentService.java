package com.payment.gateway.capability;

import com.payment.gateway.compliance.ComplianceAuditLogger;
import com.payment.gateway.compliance.SensitiveDataMasker;
import com.payment.gateway.core.CommitCycle;
import com.payment.gateway.core.GatewayConstants;
import com.payment.gateway.core.GatewayMethod;
import com.payment.gateway.core.PaymentPoller;
import com.payment.gateway.core.PollResult;
import com.payment.gateway.domain.BarcodePaymentResult;
import com.payment.gateway.domain.Notify;
import com.payment.gateway.domain.Order;
import com.payment.gateway.domain.PaymentOutcome;
import com.payment.gateway.messaging.PaymentOutcomeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * In-person payment with the buyer's payment code. The first response may only say the buyer
 * still has to confirm; the trade is then polled until it is paid or times out. Every call
 * that returns publishes exactly one {@link PaymentOutcomeEvent}. A poll that fails with an
 * exception publishes nothing; the failure is audited and rethrown, since the trade state
 * is then unknown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BarcodePaymentService {

    private final CommitCycle commitCycle;
    private final PaymentPoller poller;
    private final ApplicationEventPublisher eventPublisher;
    private final ComplianceAuditLogger auditLogger;

    public BarcodePaymentResult pay(Order order) {
        Order barcodeOrder = order.toBuilder()
                .productCode(GatewayConstants.FACE_TO_FACE_PAYMENT)
                .scene(order.getScene() != null ? order.getScene() : GatewayConstants.BAR_CODE_SCENE)
                .build();
        log.info("Barcode payment: outTradeNo={}, totalAmount={}, authCode={}",
                order.getOutTradeNo(), order.getTotalAmount(), SensitiveDataMasker.maskAuthCode(order.getAuthCode()));

        Notify notify = commitCycle.commitUnchecked(GatewayMethod.BARCODE, barcodeOrder);

        if (GatewayConstants.SUCCESS_CODE.equals(notify.getCode())) {
            return finish(order, PaymentOutcome.SUCCEEDED, notify.getTradeNo(), null, 0, notify);
        }
        if (notify.getTradeNo() == null || notify.getTradeNo().isBlank()) {
            return finish(order, PaymentOutcome.FAILED, null, notify.getSubMsg(), 0, notify);
        }

        PollResult poll;
        try {
            poll = poller.poll(notify.getTradeNo());
        } catch (RuntimeException e) {
            auditLogger.logBarcodePollFailure(order.getOutTradeNo(), notify.getTradeNo(), e);
            throw e;
        }
        if (poll.isSucceeded()) {
            return finish(order, PaymentOutcome.SUCCEEDED, notify.getTradeNo(), null, poll.getAttempts(), poll.getNotify());
        }
        return finish(order, PaymentOutcome.TIMED_OUT, notify.getTradeNo(), PaymentPoller.TIMEOUT_MESSAGE,
                poll.getAttempts(), poll.getNotify());
    }

    private BarcodePaymentResult finish(Order order, PaymentOutcome outcome, String tradeNo, String message,
                                        int pollAttempts, Notify notify) {
        BarcodePaymentResult result = BarcodePaymentResult.builder()
                .outcome(outcome)
                .outTradeNo(order.getOutTradeNo())
                .tradeNo(tradeNo)
                .message(message)
                .pollAttempts(pollAttempts)
                .notify(notify)
                .build();
        auditLogger.logBarcodeOutcome(result);

        eventPublisher.publishEvent(PaymentOutcomeEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .outTradeNo(order.getOutTradeNo())
                .tradeNo(tradeNo)
                .outcome(outcome)
                .tradeStatus(notify != null ? notify.getTradeStatus() : null)
                .totalAmount(order.getTotalAmount() != null ? order.getTotalAmount().toPlainString() : null)
                .message(message)
                .source("BARCODE")
                .timestamp(Instant.now())
                .build());
        return result;
    }
}
