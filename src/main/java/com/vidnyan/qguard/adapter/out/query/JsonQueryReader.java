package com.vidnyan.qguard.adapter.out.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.qguard.application.port.out.QueryReader;
import com.vidnyan.qguard.domain.query.AuditQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads snake_case JSON queries with Jackson.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonQueryReader implements QueryReader {

    private final ObjectMapper objectMapper;

    @Override
    public AuditQuery read(Path path) {
        try {
            AuditQuery query = objectMapper.readValue(path.toFile(), AuditQuery.class);
            log.info("Loaded query from {}", path);
            return requireObject(query, path.toString());
        } catch (IOException e) {
            throw new QueryReadException("Failed to read query from " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public AuditQuery parse(String json) {
        try {
            return requireObject(objectMapper.readValue(json, AuditQuery.class), "request body");
        } catch (JsonProcessingException e) {
            throw new QueryReadException("Malformed query JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static AuditQuery requireObject(AuditQuery query, String source) {
        if (query == null) {
            throw new QueryReadException("No query object in " + source, null);
        }
        return query;
    }
}
