package org.treqs.infrastructure.impl;

import org.treqs.domain.interfaces.ISessionStore;
import org.treqs.domain.model.TraceSession;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Plain map; {@link org.treqs.domain.TraceCoordinator} provides the locking. */
public class InMemorySessionStore implements ISessionStore {

    private Map<String, TraceSession> map = new HashMap<>();

    @Override
    public void put(TraceSession session) {
        map.put(session.id(), session);
    }

    @Override
    public Optional<TraceSession> get(String id) {
        return Optional.ofNullable(map.get(id));
    }

    @Override
    public void clear() {
        map = new HashMap<>();
    }

    @Override
    public int size() {
        return map.size();
    }
}
