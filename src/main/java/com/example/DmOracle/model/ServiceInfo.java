package com.example.DmOracle.model;

import java.util.Map;

/**
 * Descriptor returned by the API root.
 *
 * @param endpoints relative path -> what it does
 */
public record ServiceInfo(
        String service,
        String version,
        String description,
        Map<String, String> endpoints,
        String status
) {
}
