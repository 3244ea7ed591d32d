package com.tartaritech.repair_manager.entities;

import java.time.LocalDate;

import com.tartaritech.repair_manager.enums.WorkOrderStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@Table(name = "tb_work_order", indexes = {
    @Index(name = "idx_work_order_status", columnList = "status")
})
public class WorkOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "equipment_id", nullable = false)
    private Equipment equipment;

    @ManyToOne
    @JoinColumn(name = "technician_id")
    private Technician technician;

    @Column(nullable = false)
    private LocalDate dateOpened;

    private LocalDate dateClosed;

    private LocalDate dueDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WorkOrderStatus status;

    @Column(length = 4000)
    private String description;

    public static WorkOrder open(Equipment equipment, Technician technician, String description,
            LocalDate dueDate, LocalDate today) {
        WorkOrder workOrder = new WorkOrder();
        workOrder.setEquipment(equipment);
        workOrder.setTechnician(technician);
        workOrder.setDescription(description);
        workOrder.setDueDate(dueDate);
        workOrder.setDateOpened(today);
        workOrder.setStatus(WorkOrderStatus.OPEN);
        return workOrder;
    }

    public boolean isClosed() {
        return status == WorkOrderStatus.CLOSED;
    }

    /**
     * One-way transition. Returns false when the work order was already closed.
     */
    public boolean close(LocalDate today) {
        if (isClosed()) {
            return false;
        }
        this.status = WorkOrderStatus.CLOSED;
        this.dateClosed = today;
        return true;
    }
}
