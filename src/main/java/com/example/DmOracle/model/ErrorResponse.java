package com.example.DmOracle.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Error body shared by every oracle endpoint.
 */
public record ErrorResponse(
        String error,
        @JsonProperty("status_code") int statusCode,
        String timestamp
) {

    public static ErrorResponse of(String error, int statusCode) {
        return new ErrorResponse(error, statusCode, Instant.now().toString());
    }
}
