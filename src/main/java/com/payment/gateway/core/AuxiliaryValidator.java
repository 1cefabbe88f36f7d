package com.payment.gateway.core;

import com.payment.gateway.domain.Auxiliary;
import com.payment.gateway.domain.AuxiliaryType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks {@link Auxiliary} parameters against the validation group of the operation about to run.
 */
@Component
@RequiredArgsConstructor
public class AuxiliaryValidator {

    private final Validator validator;

    public void validate(Auxiliary auxiliary, AuxiliaryType type) {
        if (auxiliary == null) {
            throw new AuxiliaryValidationException(type, List.of("parameters are required"));
        }
        Set<ConstraintViolation<Auxiliary>> violations = validator.validate(auxiliary, type.getGroup());
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.toList());
            throw new AuxiliaryValidationException(type, messages);
        }
    }
}
