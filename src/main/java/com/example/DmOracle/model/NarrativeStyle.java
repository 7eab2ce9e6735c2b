package com.example.DmOracle.model;

import com.example.DmOracle.exception.InvalidRequestException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public enum NarrativeStyle {
    DESCRIPTIVE("descriptive", "rich and atmospheric, lingering on sights, sounds and smells"),
    ACTION("action", "fast-paced and dynamic, with short punchy sentences"),
    MYSTERIOUS("mysterious", "eerie and suspenseful, hinting more than it reveals"),
    DRAMATIC("dramatic", "epic and emotionally charged");

    public static final NarrativeStyle DEFAULT = DESCRIPTIVE;

    private final String value;
    private final String tone;

    NarrativeStyle(String value, String tone) {
        this.value = value;
        this.tone = tone;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Tone descriptor interpolated into the narration prompt. */
    public String tone() {
        return tone;
    }

    /**
     * Resolve a style name. Null or blank selects {@link #DEFAULT};
     * anything else must name one of the styles (case-insensitive).
     */
    public static NarrativeStyle fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException(
                        "Unknown narrative style '" + raw + "'. Valid values: " + Arrays.stream(values())
                                .map(NarrativeStyle::value)
                                .collect(Collectors.joining(", "))));
    }
}
