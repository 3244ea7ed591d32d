package com.tartaritech.repair_manager.services;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.tartaritech.repair_manager.dtos.CustomerDTO;
import com.tartaritech.repair_manager.dtos.ImportResultDTO;
import com.tartaritech.repair_manager.dtos.PartDTO;
import com.tartaritech.repair_manager.entities.Customer;
import com.tartaritech.repair_manager.entities.Part;
import com.tartaritech.repair_manager.exceptions.DataStoreException;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.CustomerRepository;
import com.tartaritech.repair_manager.repositories.PartRepository;
import com.tartaritech.repair_manager.utils.DelimitedRowsCodec;
import com.tartaritech.repair_manager.utils.RecordValidator;

/**
 * Upserts customers and parts from CSV files, or from the JSON arrays {@link DataExportService} writes when the
 * file name ends in {@code .json}. A row whose id already exists updates that record, every other row is
 * inserted. The whole file is applied in one transaction. An existing part keeps its on-hand quantity.
 */
@Service
public class DataImportService {

    private final CustomerRepository customerRepository;
    private final PartRepository partRepository;
    private final DelimitedRowsCodec delimitedRowsCodec;
    private final ObjectMapper objectMapper;
    private final RecordValidator recordValidator;
    private final BackupService backupService;
    private final Logger logger = LoggerFactory.getLogger(DataImportService.class);

    public DataImportService(CustomerRepository customerRepository, PartRepository partRepository,
            DelimitedRowsCodec delimitedRowsCodec, ObjectMapper objectMapper, RecordValidator recordValidator,
            BackupService backupService) {
        this.customerRepository = customerRepository;
        this.partRepository = partRepository;
        this.delimitedRowsCodec = delimitedRowsCodec;
        this.objectMapper = objectMapper;
        this.recordValidator = recordValidator;
        this.backupService = backupService;
    }

    @Transactional
    public ImportResultDTO importCustomers(Path source) {
        List<CustomerDTO> rows = readRows(source, CustomerDTO.class);
        logger.info("Importing {} customers from {}", rows.size(), source);
        backupFirst();

        ImportResultDTO result = new ImportResultDTO();
        int line = 1;
        for (CustomerDTO row : rows) {
            line++;
            validateRow(row, line);

            Optional<Customer> existing = row.getId() == null ? Optional.empty() : customerRepository.findById(row.getId());
            Customer entity = existing.orElseGet(Customer::new);
            CustomerService.copyToEntity(row, entity);
            customerRepository.save(entity);

            if (existing.isPresent()) {
                result.setUpdated(result.getUpdated() + 1);
            } else {
                result.setInserted(result.getInserted() + 1);
            }
        }

        logger.info("Customer import from {} done: {} inserted, {} updated", source, result.getInserted(),
                result.getUpdated());
        return result;
    }

    @Transactional
    public ImportResultDTO importParts(Path source) {
        List<PartDTO> rows = readRows(source, PartDTO.class);
        logger.info("Importing {} parts from {}", rows.size(), source);
        backupFirst();

        ImportResultDTO result = new ImportResultDTO();
        int line = 1;
        for (PartDTO row : rows) {
            line++;
            validateRow(row, line);

            Optional<Part> existing = row.getId() == null ? Optional.empty() : partRepository.findById(row.getId());
            String sku = row.getSku().trim();
            Optional<Part> sameSku = partRepository.findBySku(sku);
            if (sameSku.isPresent() && (existing.isEmpty() || !sameSku.get().getId().equals(existing.get().getId()))) {
                throw new ValidationException("line " + line + ": SKU already exists: " + sku);
            }

            Part entity;
            if (existing.isPresent()) {
                entity = existing.get();
                if (!entity.getQuantity().equals(row.getQuantity())) {
                    logger.warn("Line {}: ignoring quantity {} for part {}, stock on hand stays {}",
                            line, row.getQuantity(), sku, entity.getQuantity());
                }
                PartService.copyDetailsToEntity(row, entity);
            } else {
                entity = new Part();
                PartService.copyToEntity(row, entity);
            }
            partRepository.saveAndFlush(entity);

            if (existing.isPresent()) {
                result.setUpdated(result.getUpdated() + 1);
            } else {
                result.setInserted(result.getInserted() + 1);
            }
        }

        logger.info("Part import from {} done: {} inserted, {} updated", source, result.getInserted(),
                result.getUpdated());
        return result;
    }

    private <T> List<T> readRows(Path source, Class<T> type) {
        if (source == null) {
            throw new ValidationException("import source is required");
        }
        Path fileName = source.getFileName();
        if (fileName == null || !fileName.toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
            return delimitedRowsCodec.readRows(source, type);
        }
        try {
            return objectMapper.readValue(source.toFile(),
                    objectMapper.getTypeFactory().constructCollectionType(List.class, type));
        } catch (IOException e) {
            logger.error("Failed to read {} rows from {}", type.getSimpleName(), source, e);
            throw new DataStoreException("Failed to read " + source, e);
        }
    }

    private void validateRow(Object row, int line) {
        try {
            recordValidator.validate(row);
        } catch (ValidationException e) {
            logger.warn("Import rejected at line {}: {}", line, e.getMessage());
            throw new ValidationException("line " + line + ": " + e.getMessage());
        }
    }

    private void backupFirst() {
        if (backupService.isEnabled()) {
            backupService.backup();
        }
    }
}
