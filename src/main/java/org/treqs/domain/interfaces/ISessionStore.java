package org.treqs.domain.interfaces;

import org.treqs.domain.model.TraceSession;

import java.util.Optional;

/**
 * Session id to captured trace. Not thread-safe on its own: callers hold the
 * coordinator's exclusive lock to mutate and at least its shared lock to read.
 */
public interface ISessionStore {
    void put(TraceSession session);
    Optional<TraceSession> get(String id);
    void clear();
    int size();
}
