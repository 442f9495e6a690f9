package com.pitchcraft.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a pitch session's lifetime.
 *
 * @param eventType event type (e.g. "session.created", "session.transitioned", "session.deleted")
 * @param sessionId the session this event belongs to
 * @param phase     the session phase after the event, or null when the session is gone
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PitchEvent(
    String eventType,
    String sessionId,
    String phase,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String SESSION_CREATED = "session.created";
    public static final String SESSION_TRANSITIONED = "session.transitioned";
    public static final String SESSION_DELETED = "session.deleted";
    public static final String SESSION_EVICTED = "session.evicted";
}
