package com.tartaritech.repair_manager;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tartaritech.repair_manager.dtos.CustomerDTO;
import com.tartaritech.repair_manager.dtos.EquipmentDTO;
import com.tartaritech.repair_manager.dtos.ImportResultDTO;
import com.tartaritech.repair_manager.dtos.PartDTO;
import com.tartaritech.repair_manager.dtos.WorkOrderCreateDTO;
import com.tartaritech.repair_manager.dtos.WorkOrderRowDTO;
import com.tartaritech.repair_manager.enums.ExportFormat;
import com.tartaritech.repair_manager.enums.RecordTable;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.repositories.WorkOrderRepository;
import com.tartaritech.repair_manager.services.CustomerService;
import com.tartaritech.repair_manager.services.DataExportService;
import com.tartaritech.repair_manager.services.DataImportService;
import com.tartaritech.repair_manager.services.EquipmentService;
import com.tartaritech.repair_manager.services.PartService;
import com.tartaritech.repair_manager.services.WorkOrderService;
import com.tartaritech.repair_manager.utils.DelimitedRowsCodec;

@SpringBootTest
@DisplayName("CSV and JSON export and import")
class DataExchangeTest {

    @Autowired
    private DataExportService dataExportService;

    @Autowired
    private DataImportService dataImportService;

    @Autowired
    private DelimitedRowsCodec delimitedRowsCodec;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private EquipmentService equipmentService;

    @Autowired
    private PartService partService;

    @Autowired
    private WorkOrderService workOrderService;

    @Autowired
    private WorkOrderRepository workOrderRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @TempDir
    Path tempDir;

    private Long janeId;

    @BeforeEach
    void setup() {
        TestData.clean(jdbcTemplate);
        janeId = customerService.createCustomer(new CustomerDTO(null, "Jane", "Doe", "555-0100", null, null, null));
    }

    @Test
    @DisplayName("Exported work order rows should read back unchanged")
    void workOrderRowsShouldRoundTrip() {
        EquipmentDTO laptop = new EquipmentDTO();
        laptop.setCustomerId(janeId);
        Long laptopId = equipmentService.createEquipment(laptop);
        workOrderService.openWorkOrder(new WorkOrderCreateDTO(laptopId, null, "Battery, \"swollen\"\nsecond line",
                LocalDate.of(2030, 1, 15)));
        Long closedId = workOrderService.openWorkOrder(new WorkOrderCreateDTO(laptopId, null, "Screen", null));
        workOrderService.closeWorkOrder(closedId);

        Path csv = tempDir.resolve("work_orders.csv");
        int written = dataExportService.export(RecordTable.WORK_ORDERS, ExportFormat.CSV, csv);

        List<WorkOrderRowDTO> expected = workOrderRepository.findAll().stream()
                .sorted((a, b) -> a.getId().compareTo(b.getId()))
                .map(WorkOrderRowDTO::new)
                .collect(Collectors.toList());
        List<WorkOrderRowDTO> actual = delimitedRowsCodec.readRows(csv, WorkOrderRowDTO.class);

        assertEquals(2, written);
        assertEquals(expected, actual);
    }

    @Test
    @DisplayName("CSV header should list the row fields in order")
    void csvHeaderShouldListFields() throws Exception {
        Path csv = tempDir.resolve("customers.csv");
        dataExportService.export(RecordTable.CUSTOMERS, ExportFormat.CSV, csv);

        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals("id,firstName,lastName,phone,email,address,notes", lines.get(0));
        assertEquals(2, lines.size());
    }

    @Test
    @DisplayName("JSON export should write one object per row")
    void jsonExportShouldWriteArray() throws Exception {
        partService.createPart(new PartDTO(null, "BAT-001", "Laptop battery", 5, null));
        Path json = tempDir.resolve("out/parts.json");

        int written = dataExportService.export(RecordTable.PARTS, ExportFormat.JSON, json);

        JsonNode root = objectMapper.readTree(json.toFile());
        assertEquals(1, written);
        assertTrue(root.isArray());
        assertEquals("BAT-001", root.get(0).get("sku").asText());
        assertEquals(5, root.get(0).get("quantity").asInt());
    }

    @Test
    @DisplayName("Customer import should update known ids and insert the rest")
    void customerImportShouldUpsert() throws Exception {
        Path csv = tempDir.resolve("customers.csv");
        Files.writeString(csv, "id,firstName,lastName,phone,email,address,notes\n"
                + janeId + ",Jane,Doe-Smith,555-0101,,,\n"
                + ",Bob,Builder,555-0199,bob@example.com,,\n");

        ImportResultDTO result = dataImportService.importCustomers(csv);

        assertEquals(1, result.getInserted());
        assertEquals(1, result.getUpdated());
        assertEquals("Doe-Smith", customerService.getCustomer(janeId).getLastName());
        assertEquals("555-0101", customerService.getCustomer(janeId).getPhone());
        assertEquals(2, customerService.listCustomers().size());
    }

    @Test
    @DisplayName("An invalid row should roll back the whole import")
    void invalidRowShouldRollBackImport() throws Exception {
        Path csv = tempDir.resolve("parts.csv");
        Files.writeString(csv, "id,sku,description,quantity,unitCost\n"
                + ",FAN-01,Cooling fan,3,12.50\n"
                + ",,Missing sku,1,\n");

        ValidationException ex = assertThrows(ValidationException.class, () -> dataImportService.importParts(csv));

        assertTrue(ex.getMessage().startsWith("line 3"));
        assertTrue(partService.listParts().isEmpty());
    }

    @Test
    @DisplayName("Part import should refuse a SKU owned by another part")
    void partImportShouldRejectDuplicateSku() throws Exception {
        partService.createPart(new PartDTO(null, "BAT-001", "Laptop battery", 5, null));
        Path csv = tempDir.resolve("parts.csv");
        Files.writeString(csv, "id,sku,description,quantity,unitCost\n"
                + ",BAT-001,Another battery,1,\n");

        assertThrows(ValidationException.class, () -> dataImportService.importParts(csv));
        assertEquals(5, partService.listParts().get(0).getQuantity());
    }

    @Test
    @DisplayName("Part import should not overwrite the stock the ledger keeps")
    void partImportShouldKeepLedgerStock() throws Exception {
        Long partId = partService.createPart(new PartDTO(null, "BAT-001", "Laptop battery", 5, null));
        EquipmentDTO laptop = new EquipmentDTO();
        laptop.setCustomerId(janeId);
        Long laptopId = equipmentService.createEquipment(laptop);
        Long orderId = workOrderService.openWorkOrder(new WorkOrderCreateDTO(laptopId, null, "Battery swap", null));
        workOrderService.recordPartUsage(orderId, partId, 1);

        Path csv = tempDir.resolve("parts.csv");
        Files.writeString(csv, "id,sku,description,quantity,unitCost\n" + partId + ",BAT-001,Battery,42,\n");
        ImportResultDTO result = dataImportService.importParts(csv);

        int used = workOrderService.getWorkOrderWithDetails(orderId).getPartUsages().stream()
                .mapToInt(u -> u.getQuantity())
                .sum();
        assertEquals(1, result.getUpdated());
        assertEquals(4, partService.getPart(partId).getQuantity());
        assertEquals("Battery", partService.getPart(partId).getDescription());
        assertEquals(5, partService.getPart(partId).getQuantity() + used);
    }

    @Test
    @DisplayName("A JSON customer export should import back as updates")
    void jsonCustomerExportShouldImportBack() {
        Path json = tempDir.resolve("customers.json");
        dataExportService.export(RecordTable.CUSTOMERS, ExportFormat.JSON, json);

        ImportResultDTO result = dataImportService.importCustomers(json);

        assertEquals(0, result.getInserted());
        assertEquals(1, result.getUpdated());
        assertEquals("Doe", customerService.getCustomer(janeId).getLastName());
    }
}
