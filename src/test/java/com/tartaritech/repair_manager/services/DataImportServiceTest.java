package com.tartaritech.repair_manager.services;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.tartaritech.repair_manager.config.Config;
import com.tartaritech.repair_manager.dtos.ImportResultDTO;
import com.tartaritech.repair_manager.entities.Customer;
import com.tartaritech.repair_manager.entities.Part;
import com.tartaritech.repair_manager.repositories.CustomerRepository;
import com.tartaritech.repair_manager.repositories.PartRepository;
import com.tartaritech.repair_manager.utils.DelimitedRowsCodec;
import com.tartaritech.repair_manager.utils.RecordValidator;

import jakarta.validation.Validation;

@ExtendWith(MockitoExtension.class)
public class DataImportServiceTest {

    @Mock
    private CustomerRepository customerRepository;

    @Mock
    private PartRepository partRepository;

    @Mock
    private BackupService backupService;

    @TempDir
    Path tempDir;

    private DataImportService dataImportService;

    @BeforeEach
    void setup() {
        dataImportService = new DataImportService(customerRepository, partRepository,
                new DelimitedRowsCodec(new Config().csvMapper()), new Config().objectMapper(),
                new RecordValidator(Validation.buildDefaultValidatorFactory().getValidator()), backupService);
    }

    @Test
    public void importShouldBackupFirstWhenEnabled() throws Exception {
        Path csv = tempDir.resolve("customers.csv");
        Files.writeString(csv, "id,firstName,lastName\n5,Jane,Doe\n,Bob,Builder\n");
        Customer existing = new Customer(5L, "Janet", "Doe", null, null, null, null);
        when(backupService.isEnabled()).thenReturn(true);
        when(customerRepository.findById(5L)).thenReturn(Optional.of(existing));
        when(customerRepository.save(any(Customer.class))).thenAnswer(inv -> inv.getArgument(0));

        ImportResultDTO result = dataImportService.importCustomers(csv);

        assertEquals(1, result.getInserted());
        assertEquals(1, result.getUpdated());
        assertEquals("Jane", existing.getFirstName());
        InOrder order = inOrder(backupService, customerRepository);
        order.verify(backupService).backup();
        order.verify(customerRepository, times(2)).save(any(Customer.class));
    }

    @Test
    public void importShouldSkipBackupWhenDisabled() throws Exception {
        Path csv = tempDir.resolve("customers.csv");
        Files.writeString(csv, "id,firstName,lastName\n,Bob,Builder\n");
        when(backupService.isEnabled()).thenReturn(false);
        when(customerRepository.save(any(Customer.class))).thenAnswer(inv -> inv.getArgument(0));

        dataImportService.importCustomers(csv);

        verify(backupService, never()).backup();
    }

    @Test
    public void importShouldReadJsonArraysByExtension() throws Exception {
        Path json = tempDir.resolve("customers.json");
        Files.writeString(json, "[{\"id\":null,\"firstName\":\"Bob\",\"lastName\":\"Builder\",\"phone\":\"555-0199\"}]");
        when(backupService.isEnabled()).thenReturn(false);
        when(customerRepository.save(any(Customer.class))).thenAnswer(inv -> inv.getArgument(0));

        ImportResultDTO result = dataImportService.importCustomers(json);

        assertEquals(1, result.getInserted());
        verify(customerRepository).save(argThat(c -> "Builder".equals(c.getLastName()) && "555-0199".equals(c.getPhone())));
    }

    @Test
    public void partImportShouldKeepStockOnHandForExistingParts() throws Exception {
        Path csv = tempDir.resolve("parts.csv");
        Files.writeString(csv, "id,sku,description,quantity,unitCost\n4,BAT-001,Battery,42,19.90\n");
        Part existing = new Part(4L, "BAT-001", "Laptop battery", 4, null);
        when(backupService.isEnabled()).thenReturn(false);
        when(partRepository.findById(4L)).thenReturn(Optional.of(existing));
        when(partRepository.findBySku("BAT-001")).thenReturn(Optional.of(existing));
        when(partRepository.saveAndFlush(any(Part.class))).thenAnswer(inv -> inv.getArgument(0));

        ImportResultDTO result = dataImportService.importParts(csv);

        assertEquals(1, result.getUpdated());
        assertEquals(4, existing.getQuantity());
        assertEquals("Battery", existing.getDescription());
        assertEquals(0, new BigDecimal("19.90").compareTo(existing.getUnitCost()));
    }
}
