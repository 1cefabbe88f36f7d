package com.payment.gateway.core;

import com.payment.gateway.domain.AuxiliaryType;
import lombok.Getter;

import java.util.List;

/**
 * Thrown before any network call when the parameters of a lifecycle operation
 * miss the fields that operation requires.
 */
@Getter
public class AuxiliaryValidationException extends GatewayException {

    private final AuxiliaryType type;
    private final List<String> violations;

    public AuxiliaryValidationException(AuxiliaryType type, List<String> violations) {
        super("Invalid " + type + " parameters: " + String.join("; ", violations));
        this.type = type;
        this.violations = List.copyOf(violations);
    }
}
