package org.treqs.domain;

import java.util.Locale;

/** What the tracing middleware does with a request. */
public enum TraceAction {
    PASS_THROUGH,
    TRACE,
    READ,
    RESET;

    /**
     * Maps an action header value. Only exact (case-insensitive) {@code trace}, {@code read}
     * and {@code reset} are recognized; anything else, null included, is pass-through.
     */
    public static TraceAction fromHeader(String value) {
        if (value == null) return PASS_THROUGH;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "trace" -> TRACE;
            case "read" -> READ;
            case "reset" -> RESET;
            default -> PASS_THROUGH;
        };
    }
}
