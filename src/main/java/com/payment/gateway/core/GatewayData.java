package com.payment.gateway.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.util.HtmlUtils;

import java.math.BigDecimal;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Ordered key/value container used for outgoing requests and incoming responses alike.
 * <p>
 * Entries keep insertion order and every projection walks them in that order, so the same
 * sequence of inserts always yields the same canonical string. {@link #toCanonicalString(boolean)}
 * with {@code false} is the exact input of signing and of verification; both sides go through
 * this one method.
 * <p>
 * Instances are not thread-safe. Create one per request/response cycle.
 */
public class GatewayData {

    private static final Set<String> SIGNATURE_FIELDS = Set.of(GatewayConstants.SIGN, GatewayConstants.SIGN_TYPE);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<String, Object> values = new LinkedHashMap<>();

    /**
     * Merges the properties of {@code source}, renamed to {@code stringCase}, in declaration order.
     * Null and empty properties are skipped; existing keys are overwritten.
     */
    public GatewayData addAll(Object source, StringCase stringCase) {
        if (source == null) {
            return this;
        }
        Map<String, Object> properties = stringCase.mapper().convertValue(source, MAP_TYPE);
        properties.forEach(this::add);
        return this;
    }

    /**
     * Inserts or overwrites one entry. A null or empty value removes the key, so the
     * entry never survives with a stale value.
     */
    public GatewayData add(String key, Object value) {
        if (isEmpty(value)) {
            values.remove(key);
            return this;
        }
        values.put(key, value);
        return this;
    }

    public GatewayData remove(String key) {
        values.remove(key);
        return this;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * String form of an entry; nested objects come back as JSON text.
     */
    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : stringify(value);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * {@code k1=v1&k2=v2...} in insertion order with URL-encoded values. With
     * {@code includeSignatureFields == false} the {@code sign} and {@code sign_type}
     * entries are left out, whatever their position.
     */
    public String toCanonicalString(boolean includeSignatureFields) {
        StringJoiner joiner = new StringJoiner("&");
        values.forEach((key, value) -> {
            if (!includeSignatureFields && SIGNATURE_FIELDS.contains(key)) {
                return;
            }
            joiner.add(key + "=" + URLEncoder.encode(stringify(value), StandardCharsets.UTF_8));
        });
        return joiner.toString();
    }

    /**
     * Form body of the HTTP submission: every entry, signature included.
     */
    public String toUrlEncodedBody() {
        return toCanonicalString(true);
    }

    /**
     * Auto-submitting HTML form posting every entry to {@code url}.
     */
    public String toForm(String url) {
        StringBuilder html = new StringBuilder();
        html.append("<form id='gatewayForm' name='gatewayForm' action='")
                .append(HtmlUtils.htmlEscape(url))
                .append("' method='POST'>");
        values.forEach((key, value) -> html.append("<input type='hidden' name='")
                .append(HtmlUtils.htmlEscape(key))
                .append("' value='")
                .append(HtmlUtils.htmlEscape(stringify(value)))
                .append("'/>"));
        html.append("<input type='submit' style='display:none'/></form>");
        html.append("<script>document.forms['gatewayForm'].submit();</script>");
        return html.toString();
    }

    /**
     * Replaces the contents with the fields of a JSON object.
     *
     * @throws MalformedResponseException if {@code text} is not a JSON object
     */
    public GatewayData fromJson(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedResponseException("Response body is empty");
        }
        JsonNode node;
        try {
            node = JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response body is not valid JSON", e);
        }
        return load(node);
    }

    /**
     * Replaces the contents with the properties of an already-structured payload
     * (a map, a {@link JsonNode}, a bean), keeping its property order.
     *
     * @throws MalformedResponseException if the payload is not an object
     */
    public GatewayData fromStructured(Object payload) {
        if (payload == null) {
            throw new MalformedResponseException("Payload is null");
        }
        JsonNode node;
        try {
            node = JSON.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            throw new MalformedResponseException("Payload cannot be read as an object", e);
        }
        return load(node);
    }

    /**
     * Replaces the contents with the parameters of a query string. Anything before a
     * {@code ?} is ignored, so a full URL may be passed.
     */
    public GatewayData fromUrl(String url) {
        values.clear();
        if (url == null) {
            return this;
        }
        int queryStart = url.indexOf('?');
        String query = queryStart >= 0 ? url.substring(queryStart + 1) : url;
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int separator = pair.indexOf('=');
            String key = separator >= 0 ? pair.substring(0, separator) : pair;
            String value = separator >= 0 ? pair.substring(separator + 1) : "";
            add(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return this;
    }

    /**
     * Materializes the entries as {@code type}, reading keys in {@code stringCase}.
     */
    public <T> T toObject(Class<T> type, StringCase stringCase) {
        try {
            return stringCase.mapper().convertValue(values, type);
        } catch (IllegalArgumentException e) {
            throw new MalformedResponseException("Cannot read response as " + type.getSimpleName(), e);
        }
    }

    @Override
    public String toString() {
        return toCanonicalString(false);
    }

    private GatewayData load(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedResponseException("Payload is not a JSON object");
        }
        values.clear();
        node.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            if (value.isContainerNode()) {
                add(field.getKey(), value);
            } else if (!value.isNull()) {
                add(field.getKey(), value.asText());
            }
        });
        return this;
    }

    private static String stringify(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof JsonNode || value instanceof Map || value instanceof Iterable) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new GatewayException("Could not serialize nested value", e);
            }
        }
        return String.valueOf(value);
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() == 0;
        }
        if (value instanceof JsonNode) {
            JsonNode node = (JsonNode) value;
            return node.isNull() || node.isMissingNode();
        }
        return false;
    }
}
