package com.pitchcraft.core.session;

import com.pitchcraft.core.model.Session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keyed persistence of pitch sessions.
 * <p>
 * Implementations give read-your-writes per id and must not serialize
 * operations on distinct ids behind one another.
 */
public interface SessionStore {

    /**
     * Allocates an id for a new session. Nothing is stored under it until the
     * first {@link #put}.
     */
    String create();

    Optional<Session> get(String id);

    void put(String id, Session session);

    /** Removes the session; removing an unknown id is a no-op. */
    void delete(String id);

    List<Session> list();

    /**
     * Removes the session if it was last updated before {@code cutoff}.
     *
     * @return true when the session was removed
     */
    boolean evictIfIdle(String id, Instant cutoff);
}
