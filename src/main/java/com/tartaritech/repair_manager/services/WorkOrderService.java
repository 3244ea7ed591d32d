package com.tartaritech.repair_manager.services;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.repair_manager.dtos.WorkDetailDTO;
import com.tartaritech.repair_manager.dtos.WorkOrderCreateDTO;
import com.tartaritech.repair_manager.dtos.WorkOrderDTO;
import com.tartaritech.repair_manager.dtos.WorkOrderWithDetailsDTO;
import com.tartaritech.repair_manager.entities.Equipment;
import com.tartaritech.repair_manager.entities.Technician;
import com.tartaritech.repair_manager.entities.WorkDetail;
import com.tartaritech.repair_manager.entities.WorkOrder;
import com.tartaritech.repair_manager.exceptions.ReferenceException;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.EquipmentRepository;
import com.tartaritech.repair_manager.repositories.TechnicianRepository;
import com.tartaritech.repair_manager.repositories.WorkDetailRepository;
import com.tartaritech.repair_manager.repositories.WorkOrderRepository;
import com.tartaritech.repair_manager.utils.RecordValidator;

/**
 * Open and close work orders and append to their work log. A work order starts Open and, once Closed, stays
 * Closed.
 */
@Service
public class WorkOrderService {

    private final WorkOrderRepository workOrderRepository;
    private final WorkDetailRepository workDetailRepository;
    private final EquipmentRepository equipmentRepository;
    private final TechnicianRepository technicianRepository;
    private final InventoryLedgerService inventoryLedgerService;
    private final RecordValidator recordValidator;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(WorkOrderService.class);

    public WorkOrderService(WorkOrderRepository workOrderRepository, WorkDetailRepository workDetailRepository,
            EquipmentRepository equipmentRepository, TechnicianRepository technicianRepository,
            InventoryLedgerService inventoryLedgerService, RecordValidator recordValidator, Clock clock) {
        this.workOrderRepository = workOrderRepository;
        this.workDetailRepository = workDetailRepository;
        this.equipmentRepository = equipmentRepository;
        this.technicianRepository = technicianRepository;
        this.inventoryLedgerService = inventoryLedgerService;
        this.recordValidator = recordValidator;
        this.clock = clock;
    }

    @Transactional
    public Long openWorkOrder(WorkOrderCreateDTO dto) {
        recordValidator.validate(dto);
        logger.info("Opening work order for equipment {}", dto.getEquipmentId());

        Equipment equipment = equipmentRepository.findById(dto.getEquipmentId())
                .orElseThrow(() -> new ReferenceException("work order", "equipment", dto.getEquipmentId()));

        Technician technician = null;
        if (dto.getTechnicianId() != null) {
            technician = technicianRepository.findById(dto.getTechnicianId())
                    .orElseThrow(() -> new ReferenceException("work order", "technician", dto.getTechnicianId()));
        }

        WorkOrder workOrder = WorkOrder.open(equipment, technician, dto.getDescription().trim(),
                dto.getDueDate(), today());
        WorkOrder saved = workOrderRepository.save(workOrder);

        logger.info("Work order {} opened on {} for equipment {}", saved.getId(), saved.getDateOpened(),
                equipment.getId());
        return saved.getId();
    }

    /**
     * Appends a dated entry to the work log. Closed work orders still accept entries.
     */
    @Transactional
    public Long logDetail(Long workOrderId, String description) {
        String text = RecordValidator.requireText(description, "detail description");
        WorkOrder workOrder = findWorkOrder(workOrderId);

        WorkDetail saved = workDetailRepository.save(WorkDetail.createDetail(workOrder, text, today()));
        logger.info("Logged detail {} on work order {}", saved.getId(), workOrderId);
        return saved.getId();
    }

    /**
     * Moves the work order to Closed and stamps the close date. Closing twice keeps the first close date.
     */
    @Transactional
    public void closeWorkOrder(Long workOrderId) {
        WorkOrder workOrder = findWorkOrder(workOrderId);

        if (!workOrder.close(today())) {
            logger.info("Work order {} already closed on {}", workOrderId, workOrder.getDateClosed());
            return;
        }
        workOrderRepository.save(workOrder);
        logger.info("Work order {} closed on {}", workOrderId, workOrder.getDateClosed());
    }

    public Long recordPartUsage(Long workOrderId, Long partId, int quantity) {
        return inventoryLedgerService.consumePart(workOrderId, partId, quantity);
    }

    @Transactional(readOnly = true)
    public WorkOrderDTO getWorkOrder(Long workOrderId) {
        return new WorkOrderDTO(findWorkOrder(workOrderId));
    }

    @Transactional(readOnly = true)
    public WorkOrderWithDetailsDTO getWorkOrderWithDetails(Long workOrderId) {
        WorkOrder workOrder = findWorkOrder(workOrderId);
        List<WorkDetailDTO> details = workDetailRepository.findByWorkOrderIdOrderByDateAscIdAsc(workOrderId).stream()
                .map(WorkDetailDTO::new)
                .collect(Collectors.toList());
        return new WorkOrderWithDetailsDTO(new WorkOrderDTO(workOrder), details,
                inventoryLedgerService.usagesForWorkOrder(workOrderId));
    }

    private WorkOrder findWorkOrder(Long workOrderId) {
        if (workOrderId == null) {
            throw new ValidationException("work order id is required");
        }
        return workOrderRepository.findById(workOrderId)
                .orElseThrow(() -> new ResourceNotFoundException("WorkOrder", workOrderId));
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
