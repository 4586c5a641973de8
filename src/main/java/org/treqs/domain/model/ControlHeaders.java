package org.treqs.domain.model;

import org.treqs.domain.TraceAction;

/**
 * Control values pulled off a request. {@code key} and {@code id} are never null
 * (absent headers read as the empty string).
 */
public final class ControlHeaders {
    private final String key;
    private final TraceAction action;
    private final String id;

    public ControlHeaders(String key, TraceAction action, String id) {
        this.key = key;
        this.action = action;
        this.id = id;
    }

    public String key() { return key; }
    public TraceAction action() { return action; }
    public String id() { return id; }
}
