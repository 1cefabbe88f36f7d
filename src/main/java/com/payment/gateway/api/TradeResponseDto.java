package com.payment.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.payment.gateway.domain.Notify;
import lombok.Builder;
import lombok.Value;

/**
 * REST API response for lifecycle operations: the fields of the provider result a caller acts on.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TradeResponseDto {

    String code;
    String msg;
    String outTradeNo;
    String tradeNo;
    String tradeStatus;
    String totalAmount;
    String buyerLogonId;
    String refundFee;
    String refundAmount;
    String fundChange;
    String outRequestNo;
    String action;

    public static TradeResponseDto from(Notify notify) {
        return TradeResponseDto.builder()
                .code(notify.getCode())
                .msg(notify.getMsg())
                .outTradeNo(notify.getOutTradeNo())
                .tradeNo(notify.getTradeNo())
                .tradeStatus(notify.getTradeStatus())
                .totalAmount(notify.getTotalAmount())
                .buyerLogonId(notify.getBuyerLogonId())
                .refundFee(notify.getRefundFee())
                .refundAmount(notify.getRefundAmount())
                .fundChange(notify.getFundChange())
                .outRequestNo(notify.getOutRequestNo())
                .action(notify.getAction())
                .build();
    }
}
