package com.tartaritech.repair_manager.exceptions;

/**
 * A new record points at a parent that does not exist.
 */
public class ReferenceException extends RepairShopException {

    public ReferenceException(String entity, String parent, Long parentId) {
        super("Cannot create " + entity + ": " + parent + " id=" + parentId + " does not exist");
    }
}
