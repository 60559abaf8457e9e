package com.example.knowledgesync.logging;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation ids tie together every log line of one sync run.
 *
 * Ids generated here are "{origin}-{8 hex chars}", e.g. SYNC-1a2b3c4d, SCHEDULER-0f9e8d7c
 * or HTTP-5a6b7c8d. Ids supplied by HTTP callers are accepted as-is when they are short
 * and contain no whitespace or control characters.
 */
public final class CorrelationIds {

    public static final String MDC_KEY = "correlationId";
    public static final String HEADER = "X-Request-ID";

    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private CorrelationIds() {
    }

    public static String newId(String origin) {
        return origin + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * @return the caller's id, or empty when it is missing or unsafe to put into log lines
     */
    public static Optional<String> accept(String candidate) {
        if (candidate == null || !ACCEPTED.matcher(candidate).matches()) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    public static Optional<String> current() {
        return Optional.ofNullable(MDC.get(MDC_KEY));
    }
}
