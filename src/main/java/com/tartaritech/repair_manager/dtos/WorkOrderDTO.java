package com.tartaritech.repair_manager.dtos;

import java.time.LocalDate;

import com.tartaritech.repair_manager.entities.Customer;
import com.tartaritech.repair_manager.entities.WorkOrder;
import com.tartaritech.repair_manager.enums.WorkOrderStatus;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A work order joined with its equipment, owner and technician.
 */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
public class WorkOrderDTO {

    private Long id;
    private Long equipmentId;
    private String equipmentName;
    private String serialNumber;
    private Long customerId;
    private String customerName;
    private Long technicianId;
    private String technicianName;
    private WorkOrderStatus status;
    private LocalDate dateOpened;
    private LocalDate dateClosed;
    private LocalDate dueDate;
    private String description;

    public WorkOrderDTO(WorkOrder entity) {
        this.id = entity.getId();
        this.equipmentId = entity.getEquipment().getId();
        this.equipmentName = entity.getEquipment().getDisplayName();
        this.serialNumber = entity.getEquipment().getSerialNumber();
        Customer customer = entity.getEquipment().getCustomer();
        this.customerId = customer.getId();
        this.customerName = customer.getFullName();
        if (entity.getTechnician() != null) {
            this.technicianId = entity.getTechnician().getId();
            this.technicianName = entity.getTechnician().getName();
        }
        this.status = entity.getStatus();
        this.dateOpened = entity.getDateOpened();
        this.dateClosed = entity.getDateClosed();
        this.dueDate = entity.getDueDate();
        this.description = entity.getDescription();
    }
}
