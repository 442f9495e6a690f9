package com.pitchcraft.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One independent run of the pitch workflow.
 * <p>
 * Sessions are immutable snapshots; every engine transition produces a new
 * instance via {@link #advance(PitchState, Instant)} which the session store
 * then replaces under the same id.
 */
public record Session(
    String id,
    Instant createdAt,
    Instant updatedAt,
    PitchState state
) implements Serializable {

    public static Session create(String id, PitchState state, Instant now) {
        return new Session(id, now, now, state);
    }

    public Session advance(PitchState next, Instant now) {
        return new Session(id, createdAt, now, next);
    }

    public Phase phase() {
        return state.phase();
    }
}
