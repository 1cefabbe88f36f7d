package com.payment.gateway.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards payment outcomes to Kafka for fulfilment, reconciliation and audit consumers.
 * Events are keyed by outTradeNo so all outcomes of one order land on the same partition.
 * Delivery is asynchronous; a failed send is logged and never fails the payment itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "alipay.events.kafka.enabled", havingValue = "true")
public class PaymentEventProducer {

    private final KafkaTemplate<String, PaymentOutcomeEvent> kafkaTemplate;

    @Value("${alipay.events.kafka.topic:alipay-payment-outcomes}")
    private String topic;

    @EventListener
    public void onPaymentOutcome(PaymentOutcomeEvent event) {
        String key = event.getOutTradeNo();
        log.info("Publishing payment outcome: key={}, eventId={}, outcome={}, source={}",
                key, event.getEventId(), event.getOutcome(), event.getSource());
        CompletableFuture<SendResult<String, PaymentOutcomeEvent>> future = kafkaTemplate.send(topic, key, event);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish payment outcome key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published payment outcome: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }

    void setTopic(String topic) {
        this.topic = topic;
    }
}
