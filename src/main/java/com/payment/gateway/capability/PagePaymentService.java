package com.payment.gateway.capability;

import com.payment.gateway.core.CommitCycle;
import com.payment.gateway.core.GatewayConstants;
import com.payment.gateway.core.GatewayData;
import com.payment.gateway.core.GatewayMethod;
import com.payment.gateway.domain.Order;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Payment modes completed by the buyer's browser or app: nothing is submitted from here,
 * the signed parameters are handed to the client instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PagePaymentService {

    private final CommitCycle commitCycle;

    /**
     * Desktop web payment: an HTML form that posts itself to the gateway.
     */
    public String buildFormPayment(Order order) {
        GatewayData data = sign(GatewayMethod.WEB, order, GatewayConstants.FAST_INSTANT_TRADE_PAY);
        return data.toForm(commitCycle.getEndpoint().getRequestUrl());
    }

    /**
     * Mobile web payment: a gateway URL to redirect the buyer to.
     */
    public String buildUrlPayment(Order order) {
        GatewayData data = sign(GatewayMethod.WAP, order, GatewayConstants.QUICK_WAP_WAY);
        return commitCycle.getEndpoint().getRequestUrl() + "&" + data.toUrlEncodedBody();
    }

    /**
     * In-app payment: the signed order string the mobile SDK expects.
     */
    public String buildAppPayment(Order order) {
        return sign(GatewayMethod.APP, order, GatewayConstants.QUICK_MSECURITY_PAY).toUrlEncodedBody();
    }

    /** Mini-programs take the same order string as apps. */
    public String buildAppletPayment(Order order) {
        return buildAppPayment(order);
    }

    private GatewayData sign(GatewayMethod method, Order order, String productCode) {
        log.info("Building {} payment: outTradeNo={}, totalAmount={}", method, order.getOutTradeNo(), order.getTotalAmount());
        return commitCycle.buildSignedData(method, order.toBuilder().productCode(productCode).build());
    }
}
