package com.tartaritech.repair_manager.dtos;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tartaritech.repair_manager.entities.Equipment;

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
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "id", "customerId", "customerName", "make", "model", "cpu", "ram", "storage", "os",
        "serialNumber", "notes" })
public class EquipmentDTO {

    private Long id;

    @NotNull(message = "customer id is required")
    private Long customerId;

    private String customerName;
    private String make;
    private String model;
    private String cpu;
    private String ram;
    private String storage;
    private String os;
    private String serialNumber;
    private String notes;

    public EquipmentDTO(Equipment entity) {
        this.id = entity.getId();
        this.customerId = entity.getCustomer().getId();
        this.customerName = entity.getCustomer().getFullName();
        this.make = entity.getMake();
        this.model = entity.getModel();
        this.cpu = entity.getCpu();
        this.ram = entity.getRam();
        this.storage = entity.getStorage();
        this.os = entity.getOs();
        this.serialNumber = entity.getSerialNumber();
        this.notes = entity.getNotes();
    }
}
