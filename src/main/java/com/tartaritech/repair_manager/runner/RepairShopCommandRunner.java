package com.tartaritech.repair_manager.runner;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.tartaritech.repair_manager.dtos.ImportResultDTO;
import com.tartaritech.repair_manager.enums.ExportFormat;
import com.tartaritech.repair_manager.enums.RecordTable;
import com.tartaritech.repair_manager.exceptions.ValidationException;
import com.tartaritech.repair_manager.services.BackupService;
import com.tartaritech.repair_manager.services.DataExportService;
import com.tartaritech.repair_manager.services.DataImportService;
import com.tartaritech.repair_manager.services.DocumentService;

/**
 * Maintenance tasks driven by command line options:
 * <ul>
 * <li>{@code --backup}</li>
 * <li>{@code --export=<table> --format=csv|json --out=<file>}</li>
 * <li>{@code --import=customers|parts --in=<file.csv|file.json>}</li>
 * <li>{@code --work-order-pdf=<id> --out=<file>}, {@code --invoice-pdf=<id> --out=<file>},
 * {@code --history-pdf=<customerId> --out=<file>}</li>
 * </ul>
 * Without options nothing runs.
 */
@Component
public class RepairShopCommandRunner implements ApplicationRunner {

    private final BackupService backupService;
    private final DataExportService dataExportService;
    private final DataImportService dataImportService;
    private final DocumentService documentService;
    private final Logger logger = LoggerFactory.getLogger(RepairShopCommandRunner.class);

    public RepairShopCommandRunner(BackupService backupService, DataExportService dataExportService,
            DataImportService dataImportService, DocumentService documentService) {
        this.backupService = backupService;
        this.dataExportService = dataExportService;
        this.dataImportService = dataImportService;
        this.documentService = documentService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("backup")) {
            Path file = backupService.backup();
            backupService.cleanupOldBackups();
            logger.info("Backup written to {}", file);
        }

        if (args.containsOption("export")) {
            RecordTable table = parseTable(required(args, "export"));
            ExportFormat format = parseFormat(optional(args, "format", "csv"));
            Path out = Paths.get(required(args, "out"));
            int count = dataExportService.export(table, format, out);
            logger.info("Exported {} rows of {} to {}", count, table, out);
        }

        if (args.containsOption("import")) {
            String what = required(args, "import").trim().toLowerCase(Locale.ROOT);
            Path in = Paths.get(required(args, "in"));
            ImportResultDTO result;
            if ("customers".equals(what)) {
                result = dataImportService.importCustomers(in);
            } else if ("parts".equals(what)) {
                result = dataImportService.importParts(in);
            } else {
                throw new ValidationException("--import must be customers or parts, got: " + what);
            }
            logger.info("Imported {} from {}: {}", what, in, result);
        }

        if (args.containsOption("work-order-pdf")) {
            documentService.writeWorkOrderSlip(parseId(required(args, "work-order-pdf")), Paths.get(required(args, "out")));
        }
        if (args.containsOption("invoice-pdf")) {
            documentService.writeInvoice(parseId(required(args, "invoice-pdf")), Paths.get(required(args, "out")));
        }
        if (args.containsOption("history-pdf")) {
            documentService.writeCustomerHistory(parseId(required(args, "history-pdf")), Paths.get(required(args, "out")));
        }
    }

    private static String required(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new ValidationException("--" + name + " requires a value");
        }
        return values.get(0);
    }

    private static String optional(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() || values.get(0).isBlank() ? fallback : values.get(0);
    }

    private static RecordTable parseTable(String value) {
        try {
            return RecordTable.fromOption(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown table: " + value);
        }
    }

    private static ExportFormat parseFormat(String value) {
        try {
            return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("--format must be csv or json, got: " + value);
        }
    }

    private static Long parseId(String value) {
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Not a valid id: " + value);
        }
    }
}
