package com.tartaritech.repair_manager.dtos;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.tartaritech.repair_manager.entities.Part;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
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
@JsonPropertyOrder({ "id", "sku", "description", "quantity", "unitCost" })
public class PartDTO {

    private Long id;

    @NotBlank(message = "sku is required")
    @Size(max = 100, message = "sku must be at most 100 characters")
    private String sku;

    private String description;

    @NotNull(message = "quantity is required")
    @PositiveOrZero(message = "quantity must not be negative")
    private Integer quantity;

    @PositiveOrZero(message = "unit cost must not be negative")
    private BigDecimal unitCost;

    public PartDTO(Part entity) {
        this.id = entity.getId();
        this.sku = entity.getSku();
        this.description = entity.getDescription();
        this.quantity = entity.getQuantity();
        this.unitCost = entity.getUnitCost();
    }
}
