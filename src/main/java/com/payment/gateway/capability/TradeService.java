package com.payment.gateway.capability;

import com.payment.gateway.core.AuxiliaryValidator;
import com.payment.gateway.core.CommitCycle;
import com.payment.gateway.core.GatewayMethod;
import com.payment.gateway.domain.Auxiliary;
import com.payment.gateway.domain.AuxiliaryType;
import com.payment.gateway.domain.Notify;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Lifecycle operations on an existing trade. Parameters are validated for the operation
 * before anything is sent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeService {

    private final CommitCycle commitCycle;
    private final AuxiliaryValidator validator;

    public Notify query(Auxiliary auxiliary) {
        return commit(AuxiliaryType.QUERY, GatewayMethod.QUERY, auxiliary);
    }

    /** Cancels an unpaid trade, or refunds it when the buyer already paid. */
    public Notify cancel(Auxiliary auxiliary) {
        return commit(AuxiliaryType.CANCEL, GatewayMethod.CANCEL, auxiliary);
    }

    /** Closes a trade still waiting for the buyer. */
    public Notify close(Auxiliary auxiliary) {
        return commit(AuxiliaryType.CLOSE, GatewayMethod.CLOSE, auxiliary);
    }

    public Notify refund(Auxiliary auxiliary) {
        return commit(AuxiliaryType.REFUND, GatewayMethod.REFUND, auxiliary);
    }

    public Notify refundQuery(Auxiliary auxiliary) {
        return commit(AuxiliaryType.REFUND_QUERY, GatewayMethod.REFUND_QUERY, auxiliary);
    }

    private Notify commit(AuxiliaryType type, GatewayMethod method, Auxiliary auxiliary) {
        validator.validate(auxiliary, type);
        log.info("Trade {}: outTradeNo={}, tradeNo={}", type, auxiliary.getOutTradeNo(), auxiliary.getTradeNo());
        return commitCycle.commit(method, auxiliary);
    }
}
