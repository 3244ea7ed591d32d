package com.tartaritech.repair_manager.services;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tartaritech.repair_manager.dtos.CustomerDTO;
import com.tartaritech.repair_manager.dtos.EquipmentDTO;
import com.tartaritech.repair_manager.dtos.InvoiceDTO;
import com.tartaritech.repair_manager.dtos.PartDTO;
import com.tartaritech.repair_manager.dtos.PartUsageDTO;
import com.tartaritech.repair_manager.dtos.TechnicianDTO;
import com.tartaritech.repair_manager.dtos.WorkDetailDTO;
import com.tartaritech.repair_manager.dtos.WorkOrderRowDTO;
import com.tartaritech.repair_manager.enums.ExportFormat;
import com.tartaritech.repair_manager.enums.RecordTable;
import com.tartaritech.repair_manager.exceptions.DataStoreException;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.CustomerRepository;
import com.tartaritech.repair_manager.repositories.EquipmentRepository;
import com.tartaritech.repair_manager.repositories.InvoiceRepository;
import com.tartaritech.repair_manager.repositories.PartRepository;
import com.tartaritech.repair_manager.repositories.PartUsageRepository;
import com.tartaritech.repair_manager.repositories.TechnicianRepository;
import com.tartaritech.repair_manager.repositories.WorkDetailRepository;
import com.tartaritech.repair_manager.repositories.WorkOrderRepository;
import com.tartaritech.repair_manager.utils.DelimitedRowsCodec;

/**
 * Dumps a whole table to a CSV or JSON file, one row per record in id order.
 */
@Service
public class DataExportService {

    private static final Sort BY_ID = Sort.by("id");

    private final CustomerRepository customerRepository;
    private final EquipmentRepository equipmentRepository;
    private final TechnicianRepository technicianRepository;
    private final PartRepository partRepository;
    private final WorkOrderRepository workOrderRepository;
    private final WorkDetailRepository workDetailRepository;
    private final PartUsageRepository partUsageRepository;
    private final InvoiceRepository invoiceRepository;
    private final DelimitedRowsCodec delimitedRowsCodec;
    private final ObjectMapper objectMapper;
    private final Logger logger = LoggerFactory.getLogger(DataExportService.class);

    public DataExportService(CustomerRepository customerRepository, EquipmentRepository equipmentRepository,
            TechnicianRepository technicianRepository, PartRepository partRepository,
            WorkOrderRepository workOrderRepository, WorkDetailRepository workDetailRepository,
            PartUsageRepository partUsageRepository, InvoiceRepository invoiceRepository,
            DelimitedRowsCodec delimitedRowsCodec, ObjectMapper objectMapper) {
        this.customerRepository = customerRepository;
        this.equipmentRepository = equipmentRepository;
        this.technicianRepository = technicianRepository;
        this.partRepository = partRepository;
        this.workOrderRepository = workOrderRepository;
        this.workDetailRepository = workDetailRepository;
        this.partUsageRepository = partUsageRepository;
        this.invoiceRepository = invoiceRepository;
        this.delimitedRowsCodec = delimitedRowsCodec;
        this.objectMapper = objectMapper;
    }

    /**
     * @return number of rows written
     */
    @Transactional(readOnly = true)
    public int export(RecordTable table, ExportFormat format, Path target) {
        if (table == null || format == null || target == null) {
            throw new ValidationException("table, format and target are required");
        }
        logger.info("Exporting {} as {} to {}", table, format, target);

        int count;
        switch (table) {
            case CUSTOMERS:
                count = write(map(customerRepository.findAll(BY_ID), CustomerDTO::new), CustomerDTO.class, format, target);
                break;
            case EQUIPMENT:
                count = write(map(equipmentRepository.findAll(BY_ID), EquipmentDTO::new), EquipmentDTO.class, format, target);
                break;
            case TECHNICIANS:
                count = write(map(technicianRepository.findAll(BY_ID), TechnicianDTO::new), TechnicianDTO.class, format, target);
                break;
            case PARTS:
                count = write(map(partRepository.findAll(BY_ID), PartDTO::new), PartDTO.class, format, target);
                break;
            case WORK_ORDERS:
                count = write(map(workOrderRepository.findAll(BY_ID), WorkOrderRowDTO::new), WorkOrderRowDTO.class, format, target);
                break;
            case WORK_DETAILS:
                count = write(map(workDetailRepository.findAll(BY_ID), WorkDetailDTO::new), WorkDetailDTO.class, format, target);
                break;
            case PART_USAGES:
                count = write(map(partUsageRepository.findAll(BY_ID), PartUsageDTO::new), PartUsageDTO.class, format, target);
                break;
            case INVOICES:
                count = write(map(invoiceRepository.findAll(BY_ID), InvoiceDTO::new), InvoiceDTO.class, format, target);
                break;
            default:
                throw new ValidationException("Unsupported table: " + table);
        }

        logger.info("Exported {} {} rows to {}", count, table, target);
        return count;
    }

    private <T> int write(List<T> rows, Class<T> type, ExportFormat format, Path target) {
        if (format == ExportFormat.CSV) {
            return delimitedRowsCodec.writeRows(rows, type, target);
        }
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            objectMapper.writeValue(target.toFile(), rows);
        } catch (IOException e) {
            logger.error("Failed to write JSON export to {}", target, e);
            throw new DataStoreException("Failed to write export to " + target, e);
        }
        return rows.size();
    }

    private static <E, T> List<T> map(List<E> entities, Function<E, T> mapper) {
        return entities.stream().map(mapper).collect(Collectors.toList());
    }
}
