package com.tartaritech.repair_manager.services;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.repair_manager.dtos.PartUsageDTO;
import com.tartaritech.repair_manager.entities.Part;
import com.tartaritech.repair_manager.entities.PartUsage;
import com.tartaritech.repair_manager.entities.WorkOrder;
import com.tartaritech.repair_manager.exceptions.DataStoreException;
import com.tartaritech.repair_manager.exceptions.InsufficientStockException;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.PartRepository;
import com.tartaritech.repair_manager.repositories.PartUsageRepository;
import com.tartaritech.repair_manager.repositories.WorkOrderRepository;

/**
 * Keeps {@link Part#getQuantity()} equal to the stock on hand. Every part usage decrements the part in the
 * same transaction that records the usage.
 */
@Service
public class InventoryLedgerService {

    private final PartRepository partRepository;
    private final PartUsageRepository partUsageRepository;
    private final WorkOrderRepository workOrderRepository;
    private final Logger logger = LoggerFactory.getLogger(InventoryLedgerService.class);

    @Value("${repair-shop.ledger.allow-negative:true}")
    private boolean allowNegative;

    public InventoryLedgerService(PartRepository partRepository, PartUsageRepository partUsageRepository,
            WorkOrderRepository workOrderRepository) {
        this.partRepository = partRepository;
        this.partUsageRepository = partUsageRepository;
        this.workOrderRepository = workOrderRepository;
    }

    /**
     * Records that {@code quantity} units of a part were used on a work order and takes them out of stock.
     *
     * @return id of the new part usage
     */
    @Transactional
    public Long consumePart(Long workOrderId, Long partId, int quantity) {
        if (workOrderId == null || partId == null) {
            throw new ValidationException("work order id and part id are required");
        }
        if (quantity <= 0) {
            logger.warn("Rejected part usage with quantity {} on work order {}", quantity, workOrderId);
            throw new ValidationException("usage quantity must be greater than zero");
        }

        try {
            WorkOrder workOrder = workOrderRepository.findById(workOrderId)
                    .orElseThrow(() -> new ResourceNotFoundException("WorkOrder", workOrderId));
            Part part = partRepository.findById(partId)
                    .orElseThrow(() -> new ResourceNotFoundException("Part", partId));

            int onHand = part.getQuantity();
            if (!allowNegative && onHand < quantity) {
                logger.warn("Rejected usage of {} x {} on work order {}: only {} on hand",
                        quantity, part.getSku(), workOrderId, onHand);
                throw new InsufficientStockException(part.getSku(), onHand, quantity);
            }

            PartUsage usage = partUsageRepository.saveAndFlush(PartUsage.createUsage(workOrder, part, quantity));
            int remaining = part.consume(quantity);
            partRepository.saveAndFlush(part);

            if (remaining < 0) {
                logger.warn("Part {} is oversold: {} on hand", part.getSku(), remaining);
            }
            logger.info("Recorded usage {} of {} x {} on work order {}. Remaining: {}",
                    usage.getId(), quantity, part.getSku(), workOrderId, remaining);
            return usage.getId();
        } catch (DataAccessException e) {
            logger.error("Failed to record usage of part {} on work order {}", partId, workOrderId, e);
            throw new DataStoreException("Failed to record part usage on work order " + workOrderId, e);
        }
    }

    /**
     * Part usage history of a work order, oldest first.
     */
    @Transactional(readOnly = true)
    public List<PartUsageDTO> usagesForWorkOrder(Long workOrderId) {
        if (!workOrderRepository.existsById(workOrderId)) {
            throw new ResourceNotFoundException("WorkOrder", workOrderId);
        }
        return partUsageRepository.findByWorkOrderIdOrderByIdAsc(workOrderId).stream()
                .map(PartUsageDTO::new)
                .collect(Collectors.toList());
    }
}
