package com.tartaritech.repair_manager.dtos;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class InvoiceCreateDTO {

    @NotNull(message = "work order id is required")
    private Long workOrderId;

    @NotNull(message = "amount is required")
    @PositiveOrZero(message = "amount must not be negative")
    private BigDecimal amount;

    private LocalDate dueDate;

    private String notes;
}
