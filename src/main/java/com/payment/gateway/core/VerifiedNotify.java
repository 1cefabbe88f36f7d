package com.payment.gateway.core;

import com.payment.gateway.domain.Notify;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A push whose signature has been checked. Only {@link NotifyValidator} creates these, so
 * holding one is proof of authenticity; trade status is classified here and nowhere else.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class VerifiedNotify {

    Notify notify;

    public boolean isPaymentSucceeded() {
        return GatewayConstants.isPaid(notify.getTradeStatus());
    }

    public boolean isAwaitingBuyer() {
        return GatewayConstants.WAIT_BUYER_PAY.equals(notify.getTradeStatus());
    }
}
