package com.tartaritech.repair_manager.dtos;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
public class WorkOrderCreateDTO {

    @NotNull(message = "equipment id is required")
    private Long equipmentId;

    // null leaves the work order unassigned
    private Long technicianId;

    @NotBlank(message = "description is required")
    private String description;

    private LocalDate dueDate;
}
