package com.payment.gateway.api;

import com.payment.gateway.domain.BarcodePaymentResult;
import com.payment.gateway.domain.PaymentOutcome;
import lombok.Builder;
import lombok.Value;

/**
 * REST API response for a barcode payment.
 */
@Value
@Builder
public class BarcodePaymentResponseDto {

    String outTradeNo;
    String tradeNo;
    PaymentOutcome outcome;
    String tradeStatus;
    String message;
    int pollAttempts;

    public static BarcodePaymentResponseDto from(BarcodePaymentResult result) {
        if (result == null) {
            throw new IllegalArgumentException("BarcodePaymentResult cannot be null");
        }
        return BarcodePaymentResponseDto.builder()
                .outTradeNo(result.getOutTradeNo())
                .tradeNo(result.getTradeNo())
                .outcome(result.getOutcome())
                .tradeStatus(result.getNotify() != null ? result.getNotify().getTradeStatus() : null)
                .message(result.getMessage())
                .pollAttempts(result.getPollAttempts())
                .build();
    }
}
