package com.payment.gateway.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Parameters of query, cancel, close, refund, refund-query and bill download. Which fields are
 * required depends on the operation; the nested interfaces are the validation groups.
 */
@Value
@Builder
public class Auxiliary {

    public interface Query {}
    public interface Cancel {}
    public interface Close {}
    public interface Refund {}
    public interface RefundQuery {}
    public interface BillDownload {}

    String outTradeNo;

    /** Provider trade number. */
    String tradeNo;

    @NotNull(groups = Refund.class, message = "refundAmount is required")
    @DecimalMin(value = "0.01", groups = Refund.class, message = "refundAmount must be at least 0.01")
    BigDecimal refundAmount;

    String refundReason;

    /** Identifies one (partial) refund of a trade. */
    @NotBlank(groups = RefundQuery.class, message = "outRequestNo is required")
    String outRequestNo;

    @NotBlank(groups = BillDownload.class, message = "billType is required")
    @Pattern(regexp = "trade|signcustomer", groups = BillDownload.class, message = "billType must be trade or signcustomer")
    String billType;

    /** {@code yyyy-MM-dd} for a daily statement, {@code yyyy-MM} for a monthly one. */
    @NotBlank(groups = BillDownload.class, message = "billDate is required")
    @Pattern(regexp = "\\d{4}-\\d{2}(-\\d{2})?", groups = BillDownload.class, message = "billDate must be yyyy-MM or yyyy-MM-dd")
    String billDate;

    @JsonIgnore
    @AssertTrue(groups = {Query.class, Cancel.class, Close.class, Refund.class, RefundQuery.class},
            message = "outTradeNo or tradeNo is required")
    public boolean isTradeIdentified() {
        return hasText(outTradeNo) || hasText(tradeNo);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
