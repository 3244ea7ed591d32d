package com.tartaritech.repair_manager.entities;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.tartaritech.repair_manager.enums.InvoiceStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Entity
@Table(name = "tb_invoice")
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "work_order_id", nullable = false)
    private WorkOrder workOrder;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private InvoiceStatus status;

    @Column(nullable = false)
    private LocalDate issuedOn;

    private LocalDate dueDate;

    @Column(length = 2000)
    private String notes;

    public static Invoice issue(WorkOrder workOrder, BigDecimal amount, LocalDate issuedOn, LocalDate dueDate, String notes) {
        Invoice invoice = new Invoice();
        invoice.setWorkOrder(workOrder);
        invoice.setAmount(amount);
        invoice.setIssuedOn(issuedOn);
        invoice.setDueDate(dueDate);
        invoice.setNotes(notes);
        invoice.setStatus(InvoiceStatus.OUTSTANDING);
        return invoice;
    }
}
