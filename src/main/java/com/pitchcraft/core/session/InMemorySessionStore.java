package com.pitchcraft.core.session;

import com.pitchcraft.core.model.Session;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store. Sessions are lost on restart.
 */
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public String create() {
        String id;
        do {
            id = UUID.randomUUID().toString();
        } while (sessions.containsKey(id));
        return id;
    }

    @Override
    public Optional<Session> get(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    @Override
    public void put(String id, Session session) {
        sessions.put(id, session);
    }

    @Override
    public void delete(String id) {
        sessions.remove(id);
    }

    @Override
    public List<Session> list() {
        var all = new ArrayList<>(sessions.values());
        all.sort(Comparator.comparing(Session::createdAt));
        return all;
    }

    @Override
    public boolean evictIfIdle(String id, Instant cutoff) {
        Session current = sessions.get(id);
        return current != null && current.updatedAt().isBefore(cutoff) && sessions.remove(id, current);
    }
}
