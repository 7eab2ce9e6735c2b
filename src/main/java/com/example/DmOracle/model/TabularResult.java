package com.example.DmOracle.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rows returned by a fact-table query, column order preserved.
 */
public record TabularResult(
        List<String> columns,
        List<Map<String, Object>> rows
) {

    public TabularResult {
        columns = List.copyOf(columns);
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            // LinkedHashMap keeps column order and tolerates SQL NULLs
            copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Text rendering used as evidence in the answer prompt.
     *
     * Example:
     *   columns: name, armor_class
     *   1. name=Beholder, armor_class=18
     */
    public String describe() {
        if (rows.isEmpty()) {
            return "(no rows)";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("columns: ").append(String.join(", ", columns)).append('\n');
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            sb.append(i + 1).append(". ")
                    .append(row.entrySet().stream()
                            .map(e -> e.getKey() + "=" + e.getValue())
                            .collect(Collectors.joining(", ")));
            if (i < rows.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
