package com.example.DmOracle.exception;

/**
 * Caller-input error (blank question, unknown narrative style).
 * Raised before any external call is made and surfaced to HTTP clients as 400.
 */
public class InvalidRequestException extends OracleException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
