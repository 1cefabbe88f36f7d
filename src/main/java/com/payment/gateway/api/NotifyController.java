package com.payment.gateway.api;

import com.payment.gateway.core.GatewayConstants;
import com.payment.gateway.core.NotifyValidator;
import com.payment.gateway.core.VerifiedNotify;
import com.payment.gateway.domain.Notify;
import com.payment.gateway.domain.PaymentOutcome;
import com.payment.gateway.messaging.PaymentOutcomeEvent;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Receives the provider's asynchronous payment notifications. A notify is acted on only after
 * its signature checks out; the plain {@code success} reply stops the provider from resending.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/notify")
@RequiredArgsConstructor
@Tag(name = "Notify", description = "Asynchronous payment notifications from Alipay")
public class NotifyController {

    static final String ACKNOWLEDGEMENT = "success";

    private final NotifyValidator notifyValidator;
    private final ApplicationEventPublisher eventPublisher;

    @PostMapping(consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Payment notification",
            description = "Form-encoded notify pushed by Alipay. Answers 'success' once verified; 400 when the signature does not match.")
    public ResponseEntity<String> receive(@RequestParam Map<String, String> parameters) {
        VerifiedNotify verified = notifyValidator.validate(parameters);
        Notify notify = verified.getNotify();

        PaymentOutcome outcome = outcomeOf(verified);
        if (outcome != null) {
            eventPublisher.publishEvent(PaymentOutcomeEvent.builder()
                    .eventId(UUID.randomUUID().toString())
                    .outTradeNo(notify.getOutTradeNo())
                    .tradeNo(notify.getTradeNo())
                    .outcome(outcome)
                    .tradeStatus(notify.getTradeStatus())
                    .totalAmount(notify.getTotalAmount())
                    .source("NOTIFY")
                    .timestamp(Instant.now())
                    .build());
        } else {
            log.debug("Notify without terminal status: outTradeNo={}, tradeStatus={}", notify.getOutTradeNo(), notify.getTradeStatus());
        }
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(ACKNOWLEDGEMENT);
    }

    private static PaymentOutcome outcomeOf(VerifiedNotify verified) {
        if (verified.isPaymentSucceeded()) {
            return PaymentOutcome.SUCCEEDED;
        }
        if (GatewayConstants.TRADE_CLOSED.equals(verified.getNotify().getTradeStatus())) {
            return PaymentOutcome.FAILED;
        }
        return null;
    }
}
