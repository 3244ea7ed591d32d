package com.tartaritech.repair_manager.dtos;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class WorkOrderWithDetailsDTO {

    private WorkOrderDTO workOrder;
    private List<WorkDetailDTO> details;
    private List<PartUsageDTO> partUsages;
}
