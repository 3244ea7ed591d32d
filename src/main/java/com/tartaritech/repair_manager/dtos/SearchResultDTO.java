package com.tartaritech.repair_manager.dtos;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Customer and work order matches kept as two unranked lists.
 */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class SearchResultDTO {

    private List<CustomerDTO> customers = new ArrayList<>();
    private List<WorkOrderDTO> workOrders = new ArrayList<>();
}
