package com.payment.gateway.api;

import com.payment.gateway.domain.Auxiliary;
import lombok.Data;

import java.math.BigDecimal;

/**
 * REST API request body for trade lifecycle operations and bill download. Field requirements
 * differ per operation and are checked by the service layer.
 */
@Data
public class AuxiliaryRequestDto {

    private String outTradeNo;
    private String tradeNo;
    private BigDecimal refundAmount;
    private String refundReason;
    private String outRequestNo;
    private String billType;
    private String billDate;

    public Auxiliary toAuxiliary() {
        return Auxiliary.builder()
                .outTradeNo(outTradeNo)
                .tradeNo(tradeNo)
                .refundAmount(refundAmount)
                .refundReason(refundReason)
                .outRequestNo(outRequestNo)
                .billType(billType)
                .billDate(billDate)
                .build();
    }
}
