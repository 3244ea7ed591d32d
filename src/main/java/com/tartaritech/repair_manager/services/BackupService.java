package com.tartaritech.repair_manager.services;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import com.tartaritech.repair_manager.exceptions.DataStoreException;

/**
 * Online backups of the embedded database into zip files, plus retention cleanup.
 */
@Service
public class BackupService {

    static final String FILE_PREFIX = "repair_backup_";
    static final String FILE_SUFFIX = ".zip";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final Logger logger = LoggerFactory.getLogger(BackupService.class);

    @Value("${repair-shop.backup.enabled:true}")
    private boolean enabled;

    @Value("${repair-shop.backup.dir:./backups}")
    private String backupDir;

    @Value("${repair-shop.backup.retention-days:15}")
    private int retentionDays;

    @Value("${repair-shop.backup.on-startup:false}")
    private boolean onStartup;

    public BackupService(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void backupOnStartup() {
        if (!enabled || !onStartup) {
            return;
        }
        try {
            backup();
            cleanupOldBackups();
        } catch (DataStoreException e) {
            // startup continues without a backup
            logger.error("Startup backup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return the backup file that was written
     */
    public Path backup() {
        Path dir = Paths.get(backupDir);
        Path target = dir.resolve(FILE_PREFIX + LocalDateTime.now(clock).format(STAMP) + FILE_SUFFIX);
        try {
            Files.createDirectories(dir);
            jdbcTemplate.update("BACKUP TO ?", target.toAbsolutePath().toString());
        } catch (IOException | DataAccessException e) {
            logger.error("Backup to {} failed", target, e);
            throw new DataStoreException("Backup to " + target + " failed", e);
        }
        logger.info("Database backed up to {}", target);
        return target;
    }

    /**
     * Deletes backup files last modified more than the retention period ago.
     *
     * @return number of files deleted
     */
    public int cleanupOldBackups() {
        Path dir = Paths.get(backupDir);
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(retentionDays, ChronoUnit.DAYS);

        List<Path> candidates;
        try (Stream<Path> files = Files.list(dir)) {
            candidates = files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(FILE_PREFIX) && name.endsWith(FILE_SUFFIX);
                    })
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new DataStoreException("Failed to list backups in " + dir, e);
        }

        int deleted = 0;
        for (Path file : candidates) {
            try {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                    Files.delete(file);
                    deleted++;
                }
            } catch (IOException e) {
                logger.warn("Could not delete old backup {}: {}", file, e.getMessage());
            }
        }
        if (deleted > 0) {
            logger.info("Removed {} backups older than {} days", deleted, retentionDays);
        }
        return deleted;
    }
}
