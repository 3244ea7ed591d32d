package com.tartaritech.repair_manager.exceptions;

public class ValidationException extends RepairShopException {

    public ValidationException(String message) {
        super(message);
    }
}
