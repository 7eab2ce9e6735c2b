package com.example.DmOracle.exception;

/**
 * Transient failure of a language model call: transport error, timeout, quota, empty body.
 */
public class LanguageModelException extends OracleException {

    public LanguageModelException(String message) {
        super(message);
    }

    public LanguageModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
