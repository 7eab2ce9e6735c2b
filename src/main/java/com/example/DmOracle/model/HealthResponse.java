package com.example.DmOracle.model;

import java.util.Map;

public record HealthResponse(
        String status,
        String timestamp,
        String version,
        Map<String, Object> components
) {
}
