package com.tartaritech.repair_manager.utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tartaritech.repair_manager.exceptions.DataStoreException;

/**
 * Reads and writes typed rows as comma separated files. The header row is the property names of the row type,
 * in {@code @JsonPropertyOrder} order.
 */
@Component
public class DelimitedRowsCodec {

    private final CsvMapper csvMapper;
    private final Logger logger = LoggerFactory.getLogger(DelimitedRowsCodec.class);

    public DelimitedRowsCodec(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    public <T> int writeRows(List<T> rows, Class<T> type, Path target) {
        CsvSchema schema = csvMapper.schemaFor(type).withHeader();
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            csvMapper.writer(schema).writeValue(target.toFile(), rows);
        } catch (IOException e) {
            logger.error("Failed to write {} rows to {}", type.getSimpleName(), target, e);
            throw new DataStoreException("Failed to write rows to " + target, e);
        }
        logger.debug("Wrote {} {} rows to {}", rows.size(), type.getSimpleName(), target);
        return rows.size();
    }

    public <T> List<T> readRows(Path source, Class<T> type) {
        CsvSchema schema = csvMapper.schemaFor(type).withHeader().withColumnReordering(true);
        try (MappingIterator<T> it = csvMapper.readerFor(type).with(schema).readValues(source.toFile())) {
            List<T> rows = it.readAll();
            logger.debug("Read {} {} rows from {}", rows.size(), type.getSimpleName(), source);
            return rows;
        } catch (IOException e) {
            logger.error("Failed to read {} rows from {}", type.getSimpleName(), source, e);
            throw new DataStoreException("Failed to read rows from " + source, e);
        }
    }
}
