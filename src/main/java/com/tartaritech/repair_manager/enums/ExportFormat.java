package com.tartaritech.repair_manager.enums;

public enum ExportFormat {
    CSV,
    JSON
}
