package com.tartaritech.repair_manager.services;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.repair_manager.dtos.InvoiceCreateDTO;
import com.tartaritech.repair_manager.dtos.InvoiceDTO;
import com.tartaritech.repair_manager.entities.Invoice;
import com.tartaritech.repair_manager.entities.WorkOrder;
import com.tartaritech.repair_manager.enums.InvoiceStatus;
import com.tartaritech.repair_manager.exceptions.ReferenceException;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.InvoiceRepository;
import com.tartaritech.repair_manager.repositories.WorkOrderRepository;
import com.tartaritech.repair_manager.utils.RecordValidator;

@Service
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final WorkOrderRepository workOrderRepository;
    private final RecordValidator recordValidator;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(InvoiceService.class);

    public InvoiceService(InvoiceRepository invoiceRepository, WorkOrderRepository workOrderRepository,
            RecordValidator recordValidator, Clock clock) {
        this.invoiceRepository = invoiceRepository;
        this.workOrderRepository = workOrderRepository;
        this.recordValidator = recordValidator;
        this.clock = clock;
    }

    @Transactional
    public Long createInvoice(InvoiceCreateDTO dto) {
        recordValidator.validate(dto);

        WorkOrder workOrder = workOrderRepository.findById(dto.getWorkOrderId())
                .orElseThrow(() -> new ReferenceException("invoice", "work order", dto.getWorkOrderId()));

        Invoice saved = invoiceRepository.save(Invoice.issue(workOrder, dto.getAmount(), LocalDate.now(clock),
                dto.getDueDate(), dto.getNotes()));
        logger.info("Invoice {} issued for work order {}: {}", saved.getId(), workOrder.getId(), saved.getAmount());
        return saved.getId();
    }

    @Transactional
    public InvoiceDTO markPaid(Long invoiceId) {
        return changeStatus(invoiceId, InvoiceStatus.PAID);
    }

    @Transactional
    public InvoiceDTO markOutstanding(Long invoiceId) {
        return changeStatus(invoiceId, InvoiceStatus.OUTSTANDING);
    }

    @Transactional(readOnly = true)
    public InvoiceDTO getInvoice(Long invoiceId) {
        return new InvoiceDTO(findInvoice(invoiceId));
    }

    /**
     * Newest first. A null status lists every invoice.
     */
    @Transactional(readOnly = true)
    public List<InvoiceDTO> listInvoices(InvoiceStatus status) {
        List<Invoice> invoices = status == null
                ? invoiceRepository.findAllByOrderByIssuedOnDescIdDesc()
                : invoiceRepository.findByStatusOrderByIssuedOnDescIdDesc(status);
        return invoices.stream()
                .map(InvoiceDTO::new)
                .collect(Collectors.toList());
    }

    private InvoiceDTO changeStatus(Long invoiceId, InvoiceStatus status) {
        Invoice invoice = findInvoice(invoiceId);
        invoice.setStatus(status);
        Invoice saved = invoiceRepository.save(invoice);
        logger.info("Invoice {} marked {}", invoiceId, status.getLabel());
        return new InvoiceDTO(saved);
    }

    private Invoice findInvoice(Long invoiceId) {
        if (invoiceId == null) {
            throw new ValidationException("invoice id is required");
        }
        return invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }
}
