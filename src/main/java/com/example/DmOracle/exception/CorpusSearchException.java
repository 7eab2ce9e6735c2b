package com.example.DmOracle.exception;

public class CorpusSearchException extends OracleException {

    public CorpusSearchException(String message) {
        super(message);
    }

    public CorpusSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
