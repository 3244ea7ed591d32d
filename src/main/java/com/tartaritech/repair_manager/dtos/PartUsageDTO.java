package com.tartaritech.repair_manager.dtos;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tartaritech.repair_manager.entities.PartUsage;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@JsonPropertyOrder({ "id", "workOrderId", "partId", "sku", "partDescription", "quantity", "createdDate" })
public class PartUsageDTO {

    private Long id;
    private Long workOrderId;
    private Long partId;
    private String sku;
    private String partDescription;
    private Integer quantity;
    private LocalDateTime createdDate;

    public PartUsageDTO(PartUsage entity) {
        this.id = entity.getId();
        this.workOrderId = entity.getWorkOrder().getId();
        this.partId = entity.getPart().getId();
        this.sku = entity.getPart().getSku();
        this.partDescription = entity.getPart().getDescription();
        this.quantity = entity.getQuantity();
        this.createdDate = entity.getCreatedDate();
    }
}
