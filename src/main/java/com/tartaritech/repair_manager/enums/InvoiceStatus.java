package com.tartaritech.repair_manager.enums;

public enum InvoiceStatus {
   OUTSTANDING("Outstanding"),
   PAID("Paid");

   private final String label;

   InvoiceStatus(String label) {
      this.label = label;
   }

   public String getLabel() {
      return label;
   }
}
