package com.tartaritech.repair_manager.utils;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tartaritech.repair_manager.config.Config;
import com.tartaritech.repair_manager.dtos.WorkOrderRowDTO;
import com.tartaritech.repair_manager.enums.WorkOrderStatus;
import com.tartaritech.repair_manager.exceptions.DataStoreException;

public class DelimitedRowsCodecTest {

    private final DelimitedRowsCodec codec = new DelimitedRowsCodec(new Config().csvMapper());

    @TempDir
    Path tempDir;

    @Test
    public void rowsShouldReadBackFieldForField() {
        List<WorkOrderRowDTO> rows = List.of(
                new WorkOrderRowDTO(1L, 10L, 5L, WorkOrderStatus.CLOSED, LocalDate.of(2024, 1, 1),
                        LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 5), "Replace battery, check fan"),
                new WorkOrderRowDTO(2L, 11L, null, WorkOrderStatus.OPEN, LocalDate.of(2024, 2, 1),
                        null, null, "Line one\nLine \"two\""));
        Path file = tempDir.resolve("rows.csv");

        assertEquals(2, codec.writeRows(rows, WorkOrderRowDTO.class, file));

        assertEquals(rows, codec.readRows(file, WorkOrderRowDTO.class));
    }

    @Test
    public void headerShouldBeFieldNames() throws Exception {
        Path file = tempDir.resolve("one.csv");

        codec.writeRows(List.of(new WorkOrderRowDTO(1L, 10L, null, WorkOrderStatus.OPEN, LocalDate.of(2024, 1, 1),
                null, null, "Fan")), WorkOrderRowDTO.class, file);

        String header = Files.readAllLines(file, StandardCharsets.UTF_8).get(0);
        assertEquals("id,equipmentId,technicianId,status,dateOpened,dateClosed,dueDate,description", header);
    }

    @Test
    public void readShouldAcceptReorderedColumns() throws Exception {
        Path file = tempDir.resolve("reordered.csv");
        Files.writeString(file, "description,id,status,equipmentId,dateOpened\nFan noise,7,OPEN,3,2024-04-01\n");

        WorkOrderRowDTO row = codec.readRows(file, WorkOrderRowDTO.class).get(0);

        assertEquals(7L, row.getId());
        assertEquals(WorkOrderStatus.OPEN, row.getStatus());
        assertEquals(LocalDate.of(2024, 4, 1), row.getDateOpened());
        assertNull(row.getDateClosed());
    }

    @Test
    public void missingFileShouldRaiseDataStoreError() {
        assertThrows(DataStoreException.class,
                () -> codec.readRows(tempDir.resolve("missing.csv"), WorkOrderRowDTO.class));
    }
}
