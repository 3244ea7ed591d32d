package com.tartaritech.repair_manager.dtos;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tartaritech.repair_manager.entities.Invoice;
import com.tartaritech.repair_manager.enums.InvoiceStatus;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@JsonPropertyOrder({ "id", "workOrderId", "customerName", "amount", "status", "issuedOn", "dueDate", "notes" })
public class InvoiceDTO {

    private Long id;
    private Long workOrderId;
    private String customerName;
    private BigDecimal amount;
    private InvoiceStatus status;
    private LocalDate issuedOn;
    private LocalDate dueDate;
    private String notes;

    public InvoiceDTO(Invoice entity) {
        this.id = entity.getId();
        this.workOrderId = entity.getWorkOrder().getId();
        this.customerName = entity.getWorkOrder().getEquipment().getCustomer().getFullName();
        this.amount = entity.getAmount();
        this.status = entity.getStatus();
        this.issuedOn = entity.getIssuedOn();
        this.dueDate = entity.getDueDate();
        this.notes = entity.getNotes();
    }
}
