package com.tartaritech.repair_manager.services;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tartaritech.repair_manager.dtos.CustomerDTO;
import com.tartaritech.repair_manager.dtos.DashboardStatsDTO;
import com.tartaritech.repair_manager.dtos.DeadlineDTO;
import com.tartaritech.repair_manager.dtos.SearchResultDTO;
import com.tartaritech.repair_manager.dtos.WorkDetailDTO;
import com.tartaritech.repair_manager.dtos.WorkOrderDTO;
import com.tartaritech.repair_manager.entities.WorkOrder;
import com.tartaritech.repair_manager.enums.InvoiceStatus;
import com.tartaritech.repair_manager.enums.WorkOrderStatus;
import com.tartaritech.repair_manager.exceptions.ResourceNotFoundException;
import com.tartaritech.repair_manager.repositories.CustomerRepository;
import com.tartaritech.repair_manager.repositories.EquipmentRepository;
import com.tartaritech.repair_manager.repositories.InvoiceRepository;
import com.tartaritech.repair_manager.repositories.PartRepository;
import com.tartaritech.repair_manager.repositories.TechnicianRepository;
import com.tartaritech.repair_manager.repositories.WorkDetailRepository;
import com.tartaritech.repair_manager.repositories.WorkOrderRepository;

/**
 * Read-only views over the record store.
 */
@Service
@Transactional(readOnly = true)
public class ReportService {

    private final WorkOrderRepository workOrderRepository;
    private final WorkDetailRepository workDetailRepository;
    private final CustomerRepository customerRepository;
    private final EquipmentRepository equipmentRepository;
    private final TechnicianRepository technicianRepository;
    private final PartRepository partRepository;
    private final InvoiceRepository invoiceRepository;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(ReportService.class);

    public ReportService(WorkOrderRepository workOrderRepository, WorkDetailRepository workDetailRepository,
            CustomerRepository customerRepository, EquipmentRepository equipmentRepository,
            TechnicianRepository technicianRepository, PartRepository partRepository,
            InvoiceRepository invoiceRepository, Clock clock) {
        this.workOrderRepository = workOrderRepository;
        this.workDetailRepository = workDetailRepository;
        this.customerRepository = customerRepository;
        this.equipmentRepository = equipmentRepository;
        this.technicianRepository = technicianRepository;
        this.partRepository = partRepository;
        this.invoiceRepository = invoiceRepository;
        this.clock = clock;
    }

    /**
     * Open work orders, oldest first.
     */
    public List<WorkOrderDTO> openWorkOrders() {
        List<WorkOrderDTO> open = workOrderRepository.findByStatusOrderByDateOpenedAscIdAsc(WorkOrderStatus.OPEN)
                .stream()
                .map(WorkOrderDTO::new)
                .collect(Collectors.toList());
        logger.info("Found {} open work orders", open.size());
        return open;
    }

    /**
     * Every work order on the customer's equipment, newest first.
     */
    public List<WorkOrderDTO> workOrderHistory(Long customerId) {
        if (customerId == null || !customerRepository.existsById(customerId)) {
            throw new ResourceNotFoundException("Customer", customerId);
        }
        return workOrderRepository.findHistoryByCustomerId(customerId).stream()
                .map(WorkOrderDTO::new)
                .collect(Collectors.toList());
    }

    public List<WorkDetailDTO> workDetails(Long workOrderId) {
        if (workOrderId == null || !workOrderRepository.existsById(workOrderId)) {
            throw new ResourceNotFoundException("WorkOrder", workOrderId);
        }
        return workDetailRepository.findByWorkOrderIdOrderByDateAscIdAsc(workOrderId).stream()
                .map(WorkDetailDTO::new)
                .collect(Collectors.toList());
    }

    /**
     * Case-insensitive substring search. Customers match on name, phone or email. Work orders match on
     * description or equipment serial, or on their id when the term is a number.
     */
    public SearchResultDTO search(String term) {
        SearchResultDTO result = new SearchResultDTO();
        if (term == null || term.isBlank()) {
            return result;
        }
        String needle = term.trim();
        String pattern = escapeLike(needle);

        result.setCustomers(customerRepository.search(pattern).stream()
                .map(CustomerDTO::new)
                .collect(Collectors.toList()));
        result.setWorkOrders(workOrderRepository.search(pattern, parseId(needle)).stream()
                .map(WorkOrderDTO::new)
                .collect(Collectors.toList()));

        logger.info("Search '{}' matched {} customers and {} work orders",
                needle, result.getCustomers().size(), result.getWorkOrders().size());
        return result;
    }

    public DashboardStatsDTO dashboardStats() {
        DashboardStatsDTO stats = new DashboardStatsDTO();
        stats.setCustomers(customerRepository.count());
        stats.setEquipment(equipmentRepository.count());
        stats.setTechnicians(technicianRepository.count());
        stats.setParts(partRepository.count());
        stats.setWorkOrders(workOrderRepository.count());
        stats.setOpenWorkOrders(workOrderRepository.countByStatus(WorkOrderStatus.OPEN));

        stats.setInvoices(invoiceRepository.count());
        stats.setInvoicesTotal(invoiceRepository.sumAmounts());
        stats.setOutstandingInvoices(invoiceRepository.countByStatus(InvoiceStatus.OUTSTANDING));
        stats.setOutstandingTotal(invoiceRepository.sumAmountsByStatus(InvoiceStatus.OUTSTANDING));
        stats.setPaidInvoices(invoiceRepository.countByStatus(InvoiceStatus.PAID));
        stats.setPaidTotal(invoiceRepository.sumAmountsByStatus(InvoiceStatus.PAID));
        return stats;
    }

    /**
     * Open work orders with a due date, earliest due first.
     */
    public List<DeadlineDTO> upcomingDeadlines(int limit) {
        LocalDate today = LocalDate.now(clock);
        List<WorkOrder> due = workOrderRepository.findUpcomingDeadlines(WorkOrderStatus.OPEN,
                PageRequest.of(0, Math.max(limit, 1)));
        return due.stream()
                .map(w -> new DeadlineDTO(w.getId(), w.getDueDate(), w.getDescription(),
                        w.getEquipment().getCustomer().getFullName(), w.getDueDate().isBefore(today)))
                .collect(Collectors.toList());
    }

    /**
     * Escapes the LIKE wildcards so the term matches literally. The repository queries use {@code !} as the
     * escape character.
     */
    static String escapeLike(String term) {
        return term.replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
    }

    private static Long parseId(String term) {
        try {
            return Long.valueOf(term);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
