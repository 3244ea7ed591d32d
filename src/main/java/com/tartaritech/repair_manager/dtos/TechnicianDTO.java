package com.tartaritech.repair_manager.dtos;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tartaritech.repair_manager.entities.Technician;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@JsonPropertyOrder({ "id", "name" })
public class TechnicianDTO {

    private Long id;

    @NotBlank(message = "technician name is required")
    private String name;

    public TechnicianDTO(Technician entity) {
        this.id = entity.getId();
        this.name = entity.getName();
    }
}
