package com.payment.gateway.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Naming convention used when object properties are moved onto the wire and back.
 * Each constant owns an {@link ObjectMapper} configured for that casing that drops
 * null and empty values.
 */
public enum StringCase {

    /** {@code outTradeNo} becomes {@code out_trade_no}. */
    SNAKE(PropertyNamingStrategies.SNAKE_CASE);

    private final ObjectMapper mapper;

    StringCase(PropertyNamingStrategy strategy) {
        this.mapper = new ObjectMapper()
                .setPropertyNamingStrategy(strategy)
                .setSerializationInclusion(JsonInclude.Include.NON_EMPTY)
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Serializes {@code value} as a JSON object in this casing. Used for {@code biz_content}.
     */
    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
