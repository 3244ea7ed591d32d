package com.tartaritech.repair_manager.exceptions;

public class DataStoreException extends RepairShopException {

    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
