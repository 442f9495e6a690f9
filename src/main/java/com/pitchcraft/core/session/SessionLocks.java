package com.pitchcraft.core.session;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session mutual exclusion.
 * <p>
 * Acquisition never blocks: a second caller for the same id is rejected with
 * {@link SessionConflictException}. Distinct ids never contend.
 */
@Component
public class SessionLocks {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    public Lease tryAcquire(String sessionId) {
        if (!held.add(sessionId)) {
            throw new SessionConflictException(sessionId);
        }
        return () -> held.remove(sessionId);
    }

    /**
     * Releases the lock when closed; intended for try-with-resources.
     */
    @FunctionalInterface
    public interface Lease extends AutoCloseable {
        @Override
        void close();
    }
}
