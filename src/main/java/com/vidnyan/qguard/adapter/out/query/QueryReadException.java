package com.vidnyan.qguard.adapter.out.query;

/**
 * A query could not be read or did not parse as JSON.
 */
public class QueryReadException extends RuntimeException {

    public QueryReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
