package com.payment.gateway.domain;

import lombok.Getter;

/**
 * Lifecycle operations taking {@link Auxiliary} parameters, each bound to the
 * Bean Validation group holding its required fields.
 */
@Getter
public enum AuxiliaryType {

    QUERY(Auxiliary.Query.class),
    CANCEL(Auxiliary.Cancel.class),
    CLOSE(Auxiliary.Close.class),
    REFUND(Auxiliary.Refund.class),
    REFUND_QUERY(Auxiliary.RefundQuery.class),
    BILL_DOWNLOAD(Auxiliary.BillDownload.class);

    private final Class<?> group;

    AuxiliaryType(Class<?> group) {
        this.group = group;
    }
}
