package com.tartaritech.repair_manager.services;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.repair_manager.documents.DocumentContent;
import com.tartaritech.repair_manager.documents.DocumentRenderer;
import com.tartaritech.repair_manager.entities.Customer;
import com.tartaritech.repair_manager.entities.Equipment;
import com.tartaritech.repair_manager.entities.Invoice;
import com.tartaritech.repair_manager.entities.WorkOrder;
import com.tartaritech.repair_manager.exceptions.DataStoreException;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.repositories.CustomerRepository;
import com.tartaritech.repair_manager.repositories.InvoiceRepository;
import com.tartaritech.repair_manager.repositories.PartUsageRepository;
import com.tartaritech.repair_manager.repositories.WorkDetailRepository;
import com.tartaritech.repair_manager.repositories.WorkOrderRepository;

/**
 * Builds printable work order slips, invoices and customer histories and hands them to the
 * {@link DocumentRenderer}.
 */
@Service
public class DocumentService {

    private final WorkOrderRepository workOrderRepository;
    private final WorkDetailRepository workDetailRepository;
    private final PartUsageRepository partUsageRepository;
    private final InvoiceRepository invoiceRepository;
    private final CustomerRepository customerRepository;
    private final DocumentRenderer documentRenderer;
    private final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    @Value("${repair-shop.business.name:Business Name Here}")
    private String businessName;

    @Value("${repair-shop.business.address:}")
    private String businessAddress;

    @Value("${repair-shop.business.phone:}")
    private String businessPhone;

    @Value("${repair-shop.business.email:}")
    private String businessEmail;

    @Value("${repair-shop.business.website:}")
    private String businessWebsite;

    public DocumentService(WorkOrderRepository workOrderRepository, WorkDetailRepository workDetailRepository,
            PartUsageRepository partUsageRepository, InvoiceRepository invoiceRepository,
            CustomerRepository customerRepository, DocumentRenderer documentRenderer) {
        this.workOrderRepository = workOrderRepository;
        this.workDetailRepository = workDetailRepository;
        this.partUsageRepository = partUsageRepository;
        this.invoiceRepository = invoiceRepository;
        this.customerRepository = customerRepository;
        this.documentRenderer = documentRenderer;
    }

    @Transactional(readOnly = true)
    public DocumentContent workOrderSlip(Long workOrderId) {
        WorkOrder workOrder = workOrderRepository.findById(workOrderId)
                .orElseThrow(() -> new ResourceNotFoundException("WorkOrder", workOrderId));

        DocumentContent content = withBusinessHeader(new DocumentContent("Work Order #" + workOrder.getId()));

        DocumentContent.Section summary = content.section("Work Order")
                .line("Status", workOrder.getStatus().getLabel())
                .line("Date opened", workOrder.getDateOpened());
        if (workOrder.getDateClosed() != null) {
            summary.line("Date closed", workOrder.getDateClosed());
        }
        if (workOrder.getDueDate() != null) {
            summary.line("Due date", workOrder.getDueDate());
        }
        summary.line("Technician", workOrder.getTechnician() != null ? workOrder.getTechnician().getName() : "Unassigned");

        addCustomer(content, workOrder.getEquipment().getCustomer());
        content.section("Work Description").paragraph(workOrder.getDescription());
        addEquipment(content, workOrder.getEquipment());

        DocumentContent.Section log = content.section("Work Log");
        workDetailRepository.findByWorkOrderIdOrderByDateAscIdAsc(workOrderId)
                .forEach(d -> log.paragraph(d.getDate() + "  " + d.getDescription()));

        List<List<String>> rows = partUsageRepository.findByWorkOrderIdOrderByIdAsc(workOrderId).stream()
                .map(u -> List.of(u.getPart().getSku(), nz(u.getPart().getDescription()),
                        String.valueOf(u.getQuantity())))
                .collect(Collectors.toList());
        content.table("Parts Used", List.of("SKU", "Description", "Qty"), rows);
        return content;
    }

    @Transactional(readOnly = true)
    public DocumentContent invoiceDocument(Long invoiceId) {
        Invoice invoice = invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
        WorkOrder workOrder = invoice.getWorkOrder();

        DocumentContent content = withBusinessHeader(new DocumentContent("Invoice #" + invoice.getId()));

        DocumentContent.Section summary = content.section("Invoice")
                .line("Status", invoice.getStatus().getLabel())
                .line("Issued", invoice.getIssuedOn());
        if (invoice.getDueDate() != null) {
            summary.line("Due date", invoice.getDueDate());
        }

        addCustomer(content, workOrder.getEquipment().getCustomer());
        content.section("Related Work Order")
                .line("WO", "#" + workOrder.getId())
                .line("Description", nz(workOrder.getDescription()));
        content.section("Amount").line("Total", money(invoice.getAmount()));
        if (invoice.getNotes() != null && !invoice.getNotes().isBlank()) {
            content.section("Notes").paragraph(invoice.getNotes());
        }
        addEquipment(content, workOrder.getEquipment());
        return content;
    }

    @Transactional(readOnly = true)
    public DocumentContent customerHistory(Long customerId) {
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));

        DocumentContent content = withBusinessHeader(new DocumentContent("Service History: " + customer.getFullName()));
        addCustomer(content, customer);

        List<List<String>> rows = workOrderRepository.findHistoryByCustomerId(customerId).stream()
                .map(w -> List.of("#" + w.getId(), date(w.getDateOpened()), date(w.getDateClosed()),
                        w.getStatus().getLabel(), w.getEquipment().getDisplayName(), nz(w.getDescription())))
                .collect(Collectors.toList());
        content.table("Work Orders", List.of("WO", "Opened", "Closed", "Status", "Equipment", "Description"), rows);
        return content;
    }

    public Path writeWorkOrderSlip(Long workOrderId, Path target) {
        return write(workOrderSlip(workOrderId), target);
    }

    public Path writeInvoice(Long invoiceId, Path target) {
        return write(invoiceDocument(invoiceId), target);
    }

    public Path writeCustomerHistory(Long customerId, Path target) {
        return write(customerHistory(customerId), target);
    }

    private Path write(DocumentContent content, Path target) {
        byte[] pdf = documentRenderer.render(content);
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.write(target, pdf);
        } catch (IOException e) {
            logger.error("Failed to write {} to {}", content.getTitle(), target, e);
            throw new DataStoreException("Failed to write document to " + target, e);
        }
        logger.info("{} written to {} ({} bytes)", content.getTitle(), target, pdf.length);
        return target;
    }

    private DocumentContent withBusinessHeader(DocumentContent content) {
        content.header(businessName);
        if (businessAddress != null) {
            for (String line : businessAddress.split("\\R")) {
                content.header(line);
            }
        }
        content.header("Phone: " + nz(businessPhone) + "   Email: " + nz(businessEmail));
        if (businessWebsite != null && !businessWebsite.isBlank()) {
            content.header("Website: " + businessWebsite);
        }
        return content;
    }

    private static void addCustomer(DocumentContent content, Customer customer) {
        DocumentContent.Section section = content.section("Customer")
                .line("Name", customer.getFullName());
        if (customer.getAddress() != null && !customer.getAddress().isBlank()) {
            section.line("Address", customer.getAddress());
        }
        section.line("Phone", nz(customer.getPhone()))
                .line("Email", nz(customer.getEmail()));
    }

    private static void addEquipment(DocumentContent content, Equipment equipment) {
        content.section("Equipment")
                .line("Make", nz(equipment.getMake()))
                .line("Model", nz(equipment.getModel()))
                .line("Serial", nz(equipment.getSerialNumber()))
                .line("Cpu", nz(equipment.getCpu()))
                .line("Ram", nz(equipment.getRam()))
                .line("Storage", nz(equipment.getStorage()))
                .line("Os", nz(equipment.getOs()))
                .paragraph(equipment.getNotes());
    }

    static String money(BigDecimal amount) {
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        return String.format(Locale.US, "$%,.2f", value.setScale(2, RoundingMode.HALF_UP));
    }

    private static String date(LocalDate date) {
        return date == null ? "" : date.toString();
    }

    private static String nz(String value) {
        return value == null ? "" : value;
    }
}
