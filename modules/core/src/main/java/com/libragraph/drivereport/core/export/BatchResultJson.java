package com.libragraph.drivereport.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.libragraph.drivereport.core.batch.BatchResult;
import com.libragraph.drivereport.formats.api.DriveReportException;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.OutputStream;

/**
 * JSON view of a batch result: snake_case names, ISO-8601 instants, map entries sorted by key.
 * Identical batch results render to identical bytes.
 */
@ApplicationScoped
public class BatchResultJson {

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public String render(BatchResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new DriveReportException("Failed to render batch result", e);
        }
    }

    public byte[] renderBytes(BatchResult result) {
        try {
            return mapper.writeValueAsBytes(result);
        } catch (JsonProcessingException e) {
            throw new DriveReportException("Failed to render batch result", e);
        }
    }

    public void write(BatchResult result, OutputStream out) throws IOException {
        mapper.writeValue(out, result);
    }
}
