package com.payment.gateway.api;

import com.payment.gateway.domain.Order;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * REST API request body for initiating a payment in any mode.
 */
@Data
public class OrderRequestDto {

    /** Merchant order number. Required and unique per merchant. */
    @NotBlank(message = "outTradeNo is required")
    private String outTradeNo;

    @NotNull(message = "totalAmount is required")
    @DecimalMin(value = "0.01", message = "totalAmount must be at least 0.01")
    private BigDecimal totalAmount;

    @NotBlank(message = "subject is required")
    private String subject;

    private String body;
    private String timeoutExpress;
    /** Buyer's payment code; required by the barcode endpoint only. */
    private String authCode;
    private String scene;
    private String quitUrl;

    public Order toOrder() {
        return Order.builder()
                .outTradeNo(outTradeNo)
                .totalAmount(totalAmount)
                .subject(subject)
                .body(body)
                .timeoutExpress(timeoutExpress)
                .authCode(authCode)
                .scene(scene)
                .quitUrl(quitUrl)
                .build();
    }
}
