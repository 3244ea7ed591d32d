package com.tartaritech.repair_manager.exceptions;

public class InsufficientStockException extends ValidationException {

    private final String sku;
    private final int onHand;
    private final int requested;

    public InsufficientStockException(String sku, int onHand, int requested) {
        super("Insufficient stock for part " + sku + ": on hand=" + onHand + ", requested=" + requested);
        this.sku = sku;
        this.onHand = onHand;
        this.requested = requested;
    }

    public String getSku() {
        return sku;
    }

    public int getOnHand() {
        return onHand;
    }

    public int getRequested() {
        return requested;
    }
}
