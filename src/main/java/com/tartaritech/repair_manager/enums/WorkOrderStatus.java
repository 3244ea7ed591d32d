package com.tartaritech.repair_manager.enums;

public enum WorkOrderStatus {
   OPEN("Open"),
   CLOSED("Closed");

   private final String label;

   WorkOrderStatus(String label) {
      this.label = label;
   }

   public String getLabel() {
      return label;
   }
}
