package com.payment.gateway.core;

import java.util.List;

/**
 * Wire names and codes of the Alipay open API.
 */
public final class GatewayConstants {

    public static final String SIGN = "sign";
    public static final String SIGN_TYPE = "sign_type";
    public static final String APP_ID = "app_id";
    public static final String VERSION = "version";
    public static final String CHARSET = "charset";
    public static final String TRADE_NO = "trade_no";
    public static final String BODY = "body";

    public static final String RESPONSE_SUFFIX = "_response";

    /** Result code of a successful call. */
    public static final String SUCCESS_CODE = "10000";

    public static final String WAIT_BUYER_PAY = "WAIT_BUYER_PAY";
    public static final String TRADE_SUCCESS = "TRADE_SUCCESS";
    public static final String TRADE_FINISHED = "TRADE_FINISHED";
    public static final String TRADE_CLOSED = "TRADE_CLOSED";

    public static final String FAST_INSTANT_TRADE_PAY = "FAST_INSTANT_TRADE_PAY";
    public static final String QUICK_WAP_WAY = "QUICK_WAP_WAY";
    public static final String QUICK_MSECURITY_PAY = "QUICK_MSECURITY_PAY";
    public static final String FACE_TO_FACE_PAYMENT = "FACE_TO_FACE_PAYMENT";
    public static final String BAR_CODE_SCENE = "bar_code";

    /** Fields an asynchronous notify must carry before it can be authenticated. */
    public static final List<String> NOTIFY_REQUIRED_PARAMETERS = List.of(
            APP_ID, VERSION, CHARSET, TRADE_NO, SIGN, SIGN_TYPE);

    private GatewayConstants() {}

    /** A trade in either of these states has been paid by the buyer. */
    public static boolean isPaid(String tradeStatus) {
        return TRADE_SUCCESS.equals(tradeStatus) || TRADE_FINISHED.equals(tradeStatus);
    }
}
