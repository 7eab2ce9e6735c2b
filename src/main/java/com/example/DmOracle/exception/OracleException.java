package com.example.DmOracle.exception;

/**
 * Base type for failures raised inside the oracle pipeline.
 * Components convert these into result values at their own boundary.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
