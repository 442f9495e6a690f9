package com.pitchcraft.core.session;

import com.pitchcraft.core.events.EventBus;
import com.pitchcraft.core.events.PitchEvent;
import com.pitchcraft.core.metrics.PitchMetrics;
import com.pitchcraft.core.model.Session;
import com.pitchcraft.core.workflow.WorkflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Periodically removes sessions idle longer than
 * {@code pitchcraft.workflow.session-idle-timeout}.
 * <p>
 * A session is evicted only under its lease, so a session that is in the middle
 * of a transition is left for the next sweep.
 */
@Component
public class SessionReaper {

    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

    private final SessionStore sessionStore;
    private final SessionLocks sessionLocks;
    private final WorkflowProperties properties;
    private final EventBus eventBus;
    private final PitchMetrics metrics;

    public SessionReaper(SessionStore sessionStore, SessionLocks sessionLocks, WorkflowProperties properties,
                         EventBus eventBus, PitchMetrics metrics) {
        this.sessionStore = sessionStore;
        this.sessionLocks = sessionLocks;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${pitchcraft.workflow.reaper-interval:PT5M}",
               initialDelayString = "${pitchcraft.workflow.reaper-interval:PT5M}")
    public void reap() {
        Instant cutoff = Instant.now().minus(properties.getSessionIdleTimeout());
        try {
            List<String> evicted = new ArrayList<>();
            for (Session session : sessionStore.list()) {
                if (session.updatedAt().isBefore(cutoff) && evict(session.id(), cutoff)) {
                    evicted.add(session.id());
                }
            }
            if (evicted.isEmpty()) {
                return;
            }
            log.info("Evicted {} idle session(s)", evicted.size());
            metrics.recordEvictions(evicted.size());
            for (String id : evicted) {
                eventBus.publish(new PitchEvent(PitchEvent.SESSION_EVICTED, id, null,
                        Map.of("idleTimeout", properties.getSessionIdleTimeout().toString()), Instant.now()));
                eventBus.forget(id);
            }
        } catch (SessionStoreException e) {
            log.error("Idle session eviction failed: {}", e.getMessage(), e);
        }
    }

    private boolean evict(String sessionId, Instant cutoff) {
        try (var lease = sessionLocks.tryAcquire(sessionId)) {
            return sessionStore.evictIfIdle(sessionId, cutoff);
        } catch (SessionConflictException e) {
            log.debug("Session {} is busy, eviction deferred", sessionId);
            return false;
        }
    }
}
