package com.tartaritech.repair_manager.exceptions;

/**
 * Base type for every error the record store, ledger and lifecycle surface to callers.
 */
public abstract class RepairShopException extends RuntimeException {

    protected RepairShopException(String message) {
        super(message);
    }

    protected RepairShopException(String message, Throwable cause) {
        super(message, cause);
    }
}
