package com.linlay.chatrunner.service;

import org.springframework.http.HttpHeaders;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials in upstream request logs: auth headers, JSON secret fields, bearer tokens and
 * {@code key=} query parameters.
 */
public final class LlmLogSanitizer {

    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HEADERS = Set.of(
            HttpHeaders.AUTHORIZATION.toLowerCase(),
            "x-api-key",
            "api-key",
            "x-goog-api-key"
    );
    private static final Pattern JSON_SECRET = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|token|secret|password)\"\\s*:\\s*)\"[^\"]*\""
    );
    private static final Pattern BEARER = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final Pattern QUERY_KEY = Pattern.compile("(?i)([?&](?:key|api_key)=)[^&\\s]+");

    private LlmLogSanitizer() {
    }

    public static HttpHeaders maskHeaders(HttpHeaders headers, boolean maskSensitive) {
        HttpHeaders safe = new HttpHeaders();
        if (headers == null) {
            return safe;
        }
        headers.forEach((name, values) -> {
            if (maskSensitive && SENSITIVE_HEADERS.contains(name.toLowerCase())) {
                safe.set(name, MASK);
            } else {
                safe.addAll(name, values);
            }
        });
        return safe;
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null) {
            return "";
        }
        if (!maskSensitive || text.isEmpty()) {
            return text;
        }
        String masked = JSON_SECRET.matcher(text).replaceAll("$1\"" + MASK + "\"");
        masked = BEARER.matcher(masked).replaceAll("$1" + MASK);
        return QUERY_KEY.matcher(masked).replaceAll("$1" + MASK);
    }
}
