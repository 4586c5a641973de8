package org.treqs.domain.model;

import java.time.Instant;

/** One completed capture. Immutable; the byte array is copied on the way in and out. */
public final class TraceSession {
    private final String id;
    private final byte[] data;
    private final Instant createdAt;

    public TraceSession(String id, byte[] data, Instant createdAt) {
        this.id = id;
        this.data = data.clone();
        this.createdAt = createdAt;
    }

    public String id() { return id; }
    public byte[] data() { return data.clone(); }
    public int size() { return data.length; }
    public Instant createdAt() { return createdAt; }
}
