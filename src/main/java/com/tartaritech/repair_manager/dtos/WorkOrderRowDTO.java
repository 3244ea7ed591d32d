package com.tartaritech.repair_manager.dtos;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tartaritech.repair_manager.entities.WorkOrder;
import com.tartaritech.repair_manager.enums.WorkOrderStatus;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Flat work order row as written to and read from delimited files.
 */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "id", "equipmentId", "technicianId", "status", "dateOpened", "dateClosed", "dueDate",
        "description" })
public class WorkOrderRowDTO {

    private Long id;
    private Long equipmentId;
    private Long technicianId;
    private WorkOrderStatus status;
    private LocalDate dateOpened;
    private LocalDate dateClosed;
    private LocalDate dueDate;
    private String description;

    public WorkOrderRowDTO(WorkOrder entity) {
        this.id = entity.getId();
        this.equipmentId = entity.getEquipment().getId();
        this.technicianId = entity.getTechnician() != null ? entity.getTechnician().getId() : null;
        this.status = entity.getStatus();
        this.dateOpened = entity.getDateOpened();
        this.dateClosed = entity.getDateClosed();
        this.dueDate = entity.getDueDate();
        this.description = entity.getDescription();
    }
}
