package com.tartaritech.repair_manager.enums;

import java.util.Locale;

/**
 * Tables available to the CSV/JSON export.
 */
public enum RecordTable {
    CUSTOMERS,
    EQUIPMENT,
    TECHNICIANS,
    PARTS,
    WORK_ORDERS,
    WORK_DETAILS,
    PART_USAGES,
    INVOICES;

    public static RecordTable fromOption(String value) {
        return RecordTable.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
