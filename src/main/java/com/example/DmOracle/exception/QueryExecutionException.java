package com.example.DmOracle.exception;

/**
 * A generated query could not be executed against the fact table.
 */
public class QueryExecutionException extends OracleException {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
