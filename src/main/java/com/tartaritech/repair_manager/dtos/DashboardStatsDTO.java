package com.tartaritech.repair_manager.dtos;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class DashboardStatsDTO {
    private long customers;
    private long equipment;
    private long technicians;
    private long parts;
    private long workOrders;
    private long openWorkOrders;
    private long invoices;
    private BigDecimal invoicesTotal;
    private long outstandingInvoices;
    private BigDecimal outstandingTotal;
    private long paidInvoices;
    private BigDecimal paidTotal;
}
