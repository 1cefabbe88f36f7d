package com.payment.gateway.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A synchronous result or an asynchronous push, read from snake-case wire fields.
 * Nothing in here is trusted by itself: a push only counts once the notify validator has
 * checked its {@link #sign}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Notify {

    private String code;
    private String msg;
    private String subCode;
    private String subMsg;

    private String tradeNo;
    private String outTradeNo;
    private String tradeStatus;

    private String totalAmount;
    private String receiptAmount;
    private String buyerPayAmount;
    private String buyerId;
    private String buyerLogonId;
    private String sellerId;
    private String subject;
    private String gmtPayment;

    private String qrCode;
    private String billDownloadUrl;

    private String refundFee;
    private String refundAmount;
    private String fundChange;
    private String outRequestNo;
    /** Cancel result: {@code close} or {@code refund}. */
    private String action;

    private String notifyId;
    private String notifyType;
    private String notifyTime;
    private String appId;
    private String version;
    private String charset;

    private String sign;
    private String signType;
}
