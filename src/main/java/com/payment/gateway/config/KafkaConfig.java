package com.payment.gateway.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.gateway.messaging.PaymentOutcomeEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for {@link PaymentOutcomeEvent}, written as JSON so consumers need no Java types.
 * Only active when outcome publishing is switched on.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "alipay.events.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    /** Not a bean: an ObjectMapper bean would replace the auto-configured web mapper. */
    private static ObjectMapper outcomeObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ProducerFactory<String, PaymentOutcomeEvent> paymentOutcomeProducerFactory() {
        ObjectMapper objectMapper = outcomeObjectMapper();
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        Serializer<PaymentOutcomeEvent> serializer = new Serializer<PaymentOutcomeEvent>() {
            @Override
            public byte[] serialize(String topic, PaymentOutcomeEvent data) {
                if (data == null) {
                    return null;
                }
                try {
                    byte[] result = objectMapper.writeValueAsBytes(data);
                    log.debug("Serialized PaymentOutcomeEvent (topic={}, length={}, eventId={})", topic, result.length, data.getEventId());
                    return result;
                } catch (Exception e) {
                    log.error("Serialization failed for topic={}", topic, e);
                    throw new IllegalStateException("Failed to serialize PaymentOutcomeEvent", e);
                }
            }
        };
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, PaymentOutcomeEvent> paymentOutcomeKafkaTemplate(
            ProducerFactory<String, PaymentOutcomeEvent> paymentOutcomeProducerFactory) {
        return new KafkaTemplate<>(paymentOutcomeProducerFactory);
    }
}
