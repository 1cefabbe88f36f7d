package com.payment.gateway.capability;

import com.payment.gateway.core.CommitCycle;
import com.payment.gateway.core.GatewayMethod;
import com.payment.gateway.core.MalformedResponseException;
import com.payment.gateway.domain.Notify;
import com.payment.gateway.domain.Order;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * QR-code payment: pre-creates the trade and hands back the code the buyer scans.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanPaymentService {

    private final CommitCycle commitCycle;

    public String buildScanPayment(Order order) {
        Notify notify = commitCycle.commit(GatewayMethod.SCAN, order);
        if (notify.getQrCode() == null || notify.getQrCode().isBlank()) {
            throw new MalformedResponseException("Precreate response carries no qr_code for outTradeNo=" + order.getOutTradeNo());
        }
        log.info("QR code created: outTradeNo={}", order.getOutTradeNo());
        return notify.getQrCode();
    }
}
