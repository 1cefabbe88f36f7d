package com.payment.gateway.compliance;

import com.payment.gateway.domain.BarcodePaymentResult;
import com.payment.gateway.domain.Notify;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes one {@code [AUDIT]} line per provider call, per inbound notify and per barcode outcome
 * or failed barcode poll.
 * Signatures and buyer payment codes are masked before they reach the log.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void logRequest(String method, String parameters) {
        log.info("[AUDIT] GATEWAY_REQUEST method={} params={}", method, SensitiveDataMasker.maskParameters(parameters));
    }

    public void logResult(String method, Notify notify) {
        log.info("[AUDIT] GATEWAY_RESULT method={} code={} subCode={} outTradeNo={} tradeNo={} tradeStatus={}",
                method,
                notify.getCode(),
                notify.getSubCode(),
                notify.getOutTradeNo(),
                notify.getTradeNo(),
                notify.getTradeStatus());
    }

    public void logNotifyAccepted(Notify notify) {
        log.info("[AUDIT] NOTIFY_ACCEPTED notifyId={} outTradeNo={} tradeNo={} tradeStatus={} totalAmount={}",
                notify.getNotifyId(),
                notify.getOutTradeNo(),
                notify.getTradeNo(),
                notify.getTradeStatus(),
                notify.getTotalAmount());
    }

    public void logNotifyRejected(Notify notify) {
        log.warn("[AUDIT] NOTIFY_REJECTED notifyId={} outTradeNo={} tradeNo={} sign={}",
                notify.getNotifyId(),
                notify.getOutTradeNo(),
                notify.getTradeNo(),
                SensitiveDataMasker.maskSignature(notify.getSign()));
    }

    public void logBarcodeOutcome(BarcodePaymentResult result) {
        log.info("[AUDIT] BARCODE_OUTCOME outTradeNo={} tradeNo={} outcome={} pollAttempts={} message={}",
                result.getOutTradeNo(),
                result.getTradeNo(),
                result.getOutcome(),
                result.getPollAttempts(),
                result.getMessage());
    }

    public void logBarcodePollFailure(String outTradeNo, String tradeNo, RuntimeException error) {
        log.warn("[AUDIT] BARCODE_POLL_FAILED outTradeNo={} tradeNo={} error={}",
                outTradeNo,
                tradeNo,
                error.toString());
    }
}
