package com.tartaritech.repair_manager.services;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import com.tartaritech.repair_manager.exceptions.DataStoreException;

@ExtendWith(MockitoExtension.class)
public class BackupServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:15:30Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    @TempDir
    Path backupDir;

    private BackupService backupService;

    @BeforeEach
    void setup() {
        backupService = new BackupService(jdbcTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(backupService, "enabled", true);
        ReflectionTestUtils.setField(backupService, "backupDir", backupDir.toString());
        ReflectionTestUtils.setField(backupService, "retentionDays", 15);
        ReflectionTestUtils.setField(backupService, "onStartup", false);
    }

    @Test
    public void backupShouldIssueBackupCommandWithTimestampedName() {
        Path file = backupService.backup();

        assertEquals("repair_backup_20240601_101530.zip", file.getFileName().toString());
        verify(jdbcTemplate).update("BACKUP TO ?", file.toAbsolutePath().toString());
    }

    @Test
    public void backupShouldWrapDatabaseFailures() {
        when(jdbcTemplate.update(eq("BACKUP TO ?"), anyString()))
                .thenThrow(new DataAccessResourceFailureException("locked"));

        assertThrows(DataStoreException.class, () -> backupService.backup());
    }

    @Test
    public void cleanupShouldDeleteOnlyExpiredBackups() throws Exception {
        Path old = Files.createFile(backupDir.resolve("repair_backup_20240101_000000.zip"));
        Files.setLastModifiedTime(old, FileTime.from(NOW.minus(20, ChronoUnit.DAYS)));
        Path recent = Files.createFile(backupDir.resolve("repair_backup_20240530_000000.zip"));
        Files.setLastModifiedTime(recent, FileTime.from(NOW.minus(2, ChronoUnit.DAYS)));
        Path unrelated = Files.createFile(backupDir.resolve("notes.txt"));
        Files.setLastModifiedTime(unrelated, FileTime.from(NOW.minus(60, ChronoUnit.DAYS)));

        int deleted = backupService.cleanupOldBackups();

        assertEquals(1, deleted);
        assertFalse(Files.exists(old));
        assertTrue(Files.exists(recent));
        assertTrue(Files.exists(unrelated));
    }

    @Test
    public void startupBackupShouldBeSkippedUnlessEnabled() {
        backupService.backupOnStartup();

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    public void startupBackupShouldRunWhenConfigured() {
        ReflectionTestUtils.setField(backupService, "onStartup", true);

        backupService.backupOnStartup();

        verify(jdbcTemplate).update(eq("BACKUP TO ?"), anyString());
    }
}
