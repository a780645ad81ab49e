package com.vidnyan.qguard.application.port.out;

import com.vidnyan.qguard.domain.query.AuditQuery;

import java.nio.file.Path;

/**
 * Port for loading candidate queries.
 * Implemented by adapters that read from files, message payloads, etc.
 */
public interface QueryReader {

    /**
     * Read one query from the given file.
     * @throws com.vidnyan.qguard.adapter.out.query.QueryReadException if the file is missing or malformed
     */
    AuditQuery read(Path path);

    /**
     * Read one query from raw JSON text.
     */
    AuditQuery parse(String json);
}
