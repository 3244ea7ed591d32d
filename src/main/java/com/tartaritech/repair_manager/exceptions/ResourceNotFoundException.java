package com.tartaritech.repair_manager.exceptions;

public class ResourceNotFoundException extends RepairShopException {

    private final String entity;
    private final Long id;

    public ResourceNotFoundException(String entity, Long id) {
        super(entity + " not found. id=" + id);
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public Long getId() {
        return id;
    }
}
