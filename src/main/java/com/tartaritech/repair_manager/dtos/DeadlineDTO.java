package com.tartaritech.repair_manager.dtos;

import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class DeadlineDTO {
    private Long workOrderId;
    private LocalDate dueDate;
    private String description;
    private String customerName;
    private boolean overdue;
}
