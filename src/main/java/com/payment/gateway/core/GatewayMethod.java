package com.payment.gateway.core;

import lombok.Getter;

/**
 * Open API methods. The method decides the response key of the envelope:
 * {@code alipay.trade.query} answers under {@code alipay_trade_query_response}.
 */
@Getter
public enum GatewayMethod {

    WEB("alipay.trade.page.pay"),
    WAP("alipay.trade.wap.pay"),
    APP("alipay.trade.app.pay"),
    SCAN("alipay.trade.precreate"),
    BARCODE("alipay.trade.pay"),
    QUERY("alipay.trade.query"),
    CANCEL("alipay.trade.cancel"),
    CLOSE("alipay.trade.close"),
    REFUND("alipay.trade.refund"),
    REFUND_QUERY("alipay.trade.fastpay.refund.query"),
    BILL_DOWNLOAD("alipay.data.dataservice.bill.downloadurl.query");

    private final String wireName;

    GatewayMethod(String wireName) {
        this.wireName = wireName;
    }

    public String getResponseKey() {
        return wireName.replace('.', '_') + GatewayConstants.RESPONSE_SUFFIX;
    }
}
