package com.tartaritech.repair_manager.utils;

import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.tartaritech.repair_manager.exceptions.ValidationException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

/**
 * Runs the bean validation constraints of an input DTO and reports every violation at once.
 */
@Component
public class RecordValidator {

    private final Validator validator;

    public RecordValidator(Validator validator) {
        this.validator = validator;
    }

    public <T> void validate(T record) {
        if (record == null) {
            throw new ValidationException("record is required");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ValidationException(message);
        }
    }

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value.trim();
    }
}
