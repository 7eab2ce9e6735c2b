package com.example.DmOracle.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SqlTextExtractor {

    private SqlTextExtractor() {
    }

    /**
     * Pattern for fenced blocks: ```sql ... ``` or ``` ... ```
     */
    private static final Pattern FENCED = Pattern.compile(
            "```[a-zA-Z]*\\s*(.*?)\\s*```",
            Pattern.DOTALL
    );

    /**
     * Pattern for an unterminated opening fence, e.g. a truncated reply.
     */
    private static final Pattern OPEN_FENCE = Pattern.compile(
            "^```[a-zA-Z]*\\s*",
            Pattern.DOTALL
    );

    private static final Pattern TRAILING_SEMICOLONS = Pattern.compile("[;\\s]+$");

    /**
     * Pull the query out of a model reply: strip code fences and trailing semicolons.
     * Returns an empty string when nothing usable is left.
     */
    public static String extract(String reply) {
        if (reply == null) {
            return "";
        }
        String text = reply.trim();
        if (text.isEmpty()) {
            return "";
        }

        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            text = fenced.group(1);
        } else {
            text = OPEN_FENCE.matcher(text).replaceFirst("");
        }

        return TRAILING_SEMICOLONS.matcher(text.trim()).replaceAll("");
    }
}
