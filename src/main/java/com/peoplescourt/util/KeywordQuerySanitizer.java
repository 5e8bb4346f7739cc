package com.peoplescourt.util;

import org.springframework.stereotype.Component;

/**
 * Reduces a scenario to plain search terms: only the first line is kept and
 * characters with meaning in the full-text query syntax become spaces.
 */
@Component
public class KeywordQuerySanitizer {

    private static final String RESERVED = ":()[]\"?*-/\\";

    public String sanitize(String text) {
        if (text == null) {
            return "";
        }

        String firstLine = text.split("\\R", 2)[0].strip();

        StringBuilder cleaned = new StringBuilder(firstLine.length());
        for (char c : firstLine.toCharArray()) {
            cleaned.append(RESERVED.indexOf(c) >= 0 ? ' ' : c);
        }
        return cleaned.toString().strip();
    }
}
