package com.payment.gateway.core;

import com.payment.gateway.compliance.ComplianceAuditLogger;
import com.payment.gateway.domain.Merchant;
import com.payment.gateway.domain.Notify;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Authenticates notifies pushed by the provider. Verification uses the merchant's configured
 * sign type, never the one the push claims, and the same canonical projection requests are signed with.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotifyValidator {

    private final Merchant merchant;
    private final RsaSigner signer;
    private final ComplianceAuditLogger auditLogger;

    /**
     * @param parameters form parameters of the push, in the order received
     * @throws MalformedResponseException if a parameter needed for authentication is missing
     * @throws SignatureMismatchException if the signature does not verify
     */
    public VerifiedNotify validate(Map<String, String> parameters) {
        for (String required : GatewayConstants.NOTIFY_REQUIRED_PARAMETERS) {
            String value = parameters.get(required);
            if (value == null || value.isBlank()) {
                throw new MalformedResponseException("Notify is missing required parameter " + required);
            }
        }

        GatewayData data = new GatewayData().fromStructured(parameters);
        Notify notify = data.toObject(Notify.class, StringCase.SNAKE);
        data.remove(GatewayConstants.SIGN);
        data.remove(GatewayConstants.SIGN_TYPE);

        boolean valid = signer.verify(data.toCanonicalString(false), notify.getSign(),
                merchant.getAlipayPublicKey(), merchant.getSignType());
        if (!valid) {
            auditLogger.logNotifyRejected(notify);
            throw new SignatureMismatchException("Notify signature does not match for tradeNo=" + notify.getTradeNo());
        }

        auditLogger.logNotifyAccepted(notify);
        return new VerifiedNotify(notify);
    }
}
