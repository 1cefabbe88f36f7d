package com.payment.gateway.core;

import com.payment.gateway.compliance.ComplianceAuditLogger;
import com.payment.gateway.domain.Merchant;
import com.payment.gateway.domain.Notify;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One request/response round trip with the open API: assemble and sign the parameters,
 * POST them, unwrap the JSON envelope, read the result as a {@link Notify} and check its code.
 * <p>
 * Every call builds its own {@link GatewayData}, so a single instance can serve concurrent
 * independent payments. Calls block the calling thread until the provider answers; transport
 * failures propagate unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommitCycle {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Merchant merchant;
    private final GatewayEndpoint endpoint;
    private final GatewayTransport transport;
    private final RsaSigner signer;
    private final Clock clock;
    private final ComplianceAuditLogger auditLogger;

    /**
     * Commits {@code method} and requires the success code.
     *
     * @throws GatewayOperationException if the provider answers with any other code
     */
    public Notify commit(GatewayMethod method, Object bizContent) {
        Notify notify = commitUnchecked(method, bizContent);
        if (!GatewayConstants.SUCCESS_CODE.equals(notify.getCode())) {
            log.warn("Gateway operation failed: method={}, code={}, subCode={}, subMsg={}",
                    method.getWireName(), notify.getCode(), notify.getSubCode(), notify.getSubMsg());
            throw new GatewayOperationException(notify.getCode(), notify.getSubCode(), notify.getSubMsg());
        }
        return notify;
    }

    /**
     * Commits {@code method} and returns whatever the provider answered, success or not.
     * Used where a non-success code is a state to act on rather than an error.
     */
    public Notify commitUnchecked(GatewayMethod method, Object bizContent) {
        GatewayData request = buildSignedData(method.getWireName(), bizContent);
        String body = submit(method.getWireName(), request);

        GatewayData envelope = new GatewayData().fromJson(body);
        String sign = envelope.getString(GatewayConstants.SIGN);
        GatewayData result = unwrap(envelope, method.getResponseKey());
        // The envelope signature covers the outer body; it rides along for information only.
        result.add(GatewayConstants.SIGN, sign);

        Notify notify = result.toObject(Notify.class, StringCase.SNAKE);
        auditLogger.logResult(method.getWireName(), notify);
        return notify;
    }

    /**
     * Same skeleton as {@link #commit} for an arbitrary method and result type. The result also
     * carries the envelope {@code sign} and the raw response {@code body}. No result code is
     * checked; the caller's type decides what matters.
     */
    public <T> T execute(GatewayRequest<T> request) {
        GatewayData data = buildSignedData(request.getMethod(), request.getBizContent());
        String body = submit(request.getMethod(), data);

        GatewayData envelope = new GatewayData().fromJson(body);
        String sign = envelope.getString(GatewayConstants.SIGN);
        String responseKey = request.getResponseKey() != null ? request.getResponseKey() : firstPayloadKey(envelope);
        GatewayData result = unwrap(envelope, responseKey);
        result.add(GatewayConstants.SIGN, sign);
        result.add(GatewayConstants.BODY, body);
        return result.toObject(request.getResponseType(), StringCase.SNAKE);
    }

    /**
     * Signed parameter string for client SDKs, which submit it themselves.
     */
    public String sdkExecute(GatewayRequest<?> request) {
        return buildSignedData(request.getMethod(), request.getBizContent()).toUrlEncodedBody();
    }

    public GatewayData buildSignedData(GatewayMethod method, Object bizContent) {
        return buildSignedData(method.getWireName(), bizContent);
    }

    /**
     * Public parameters for {@code method} followed by the signature over them.
     */
    public GatewayData buildSignedData(String method, Object bizContent) {
        GatewayData data = new GatewayData();
        data.addAll(publicParameters(method, bizContent), StringCase.SNAKE);
        data.add(GatewayConstants.SIGN, sign(data));
        return data;
    }

    public String sign(GatewayData data) {
        return signer.sign(data.toCanonicalString(false), merchant.getPrivateKey(), merchant.getSignType());
    }

    public GatewayEndpoint getEndpoint() {
        return endpoint;
    }

    private PublicParameters publicParameters(String method, Object bizContent) {
        return PublicParameters.builder()
                .appId(merchant.getAppId())
                .bizContent(toBizContent(bizContent))
                .charset(merchant.getCharset())
                .format(merchant.getFormat())
                .method(method)
                .notifyUrl(merchant.getNotifyUrl())
                .returnUrl(merchant.getReturnUrl())
                .signType(merchant.getSignType().name())
                .timestamp(LocalDateTime.now(clock).format(TIMESTAMP_FORMAT))
                .version(merchant.getVersion())
                .build();
    }

    private String submit(String method, GatewayData request) {
        auditLogger.logRequest(method, request.toUrlEncodedBody());
        long start = System.currentTimeMillis();
        String body = transport.post(endpoint.getRequestUrl(), request.toUrlEncodedBody());
        log.debug("Gateway call completed: method={}, latencyMs={}", method, System.currentTimeMillis() - start);
        return body;
    }

    private static GatewayData unwrap(GatewayData envelope, String responseKey) {
        String payload = envelope.getString(responseKey);
        if (payload == null) {
            throw new MalformedResponseException("Response envelope has no " + responseKey);
        }
        return new GatewayData().fromJson(payload);
    }

    private static String firstPayloadKey(GatewayData envelope) {
        return envelope.asMap().keySet().stream()
                .filter(key -> !GatewayConstants.SIGN.equals(key))
                .findFirst()
                .orElseThrow(() -> new MalformedResponseException("Response envelope carries no result"));
    }

    private static String toBizContent(Object bizContent) {
        if (bizContent == null) {
            return null;
        }
        if (bizContent instanceof String) {
            return (String) bizContent;
        }
        return StringCase.SNAKE.toJson(bizContent);
    }
}
