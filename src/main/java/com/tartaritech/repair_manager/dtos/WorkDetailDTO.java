package com.tartaritech.repair_manager.dtos;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tartaritech.repair_manager.entities.WorkDetail;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@JsonPropertyOrder({ "id", "workOrderId", "date", "description" })
public class WorkDetailDTO {

    private Long id;
    private Long workOrderId;
    private LocalDate date;
    private String description;

    public WorkDetailDTO(WorkDetail entity) {
        this.id = entity.getId();
        this.workOrderId = entity.getWorkOrder().getId();
        this.date = entity.getDate();
        this.description = entity.getDescription();
    }
}
