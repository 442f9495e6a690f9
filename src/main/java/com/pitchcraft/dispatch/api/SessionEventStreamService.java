package com.pitchcraft.dispatch.api;

import com.pitchcraft.core.events.EventBus;
import com.pitchcraft.core.events.PitchEvent;
import com.pitchcraft.core.model.Phase;
import com.pitchcraft.core.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Streams a session's {@link PitchEvent}s to HTTP clients as server-sent events.
 * <p>
 * Each stream subscribes to the {@link EventBus} for one session and is completed
 * once the session reaches DONE or CAPPED, or is deleted or evicted. Idle streams
 * get a comment frame every {@code pitchcraft.events.heartbeat-interval} so proxies
 * keep the connection open.
 */
@Service
public class SessionEventStreamService {

    private static final Logger log = LoggerFactory.getLogger(SessionEventStreamService.class);

    static final String SNAPSHOT = "session.snapshot";

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);

    private final EventBus eventBus;
    private final long timeoutMs;
    private final CopyOnWriteArrayList<Stream> streams = new CopyOnWriteArrayList<>();

    @Autowired
    public SessionEventStreamService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT);
    }

    SessionEventStreamService(EventBus eventBus, Duration timeout) {
        this.eventBus = eventBus;
        this.timeoutMs = timeout.toMillis();
    }

    /**
     * Opens a stream of events for one session. The first frame is a
     * {@code session.snapshot} of its current phase; a session that is already
     * finished gets only that frame.
     */
    public SseEmitter open(Session session) {
        String sessionId = session.id();
        SseEmitter emitter = newEmitter(timeoutMs);
        var stream = new Stream(sessionId, emitter);
        stream.subscription = eventBus.subscribe(sessionId, event -> forward(stream, event));
        streams.add(stream);

        emitter.onCompletion(() -> close(stream));
        emitter.onTimeout(() -> close(stream));
        emitter.onError(ex -> close(stream));

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("session_id", sessionId);
        snapshot.put("phase", session.phase().name());
        snapshot.put("autoRefineCount", session.state().autoRefineCount());
        snapshot.put("totalIterationCount", session.state().totalIterationCount());
        snapshot.put("timestamp", session.updatedAt().toString());
        try {
            emitter.send(SseEmitter.event().name(SNAPSHOT).data(snapshot));
        } catch (IOException e) {
            log.debug("Stream for session {} closed before the first frame: {}", sessionId, e.getMessage());
            emitter.completeWithError(e);
            close(stream);
            return emitter;
        }
        if (session.phase().isTerminal()) {
            emitter.complete();
            close(stream);
        } else {
            log.info("Event stream opened for session {}", sessionId);
        }
        return emitter;
    }

    public int openStreamCount() {
        return streams.size();
    }

    @Scheduled(fixedDelayString = "${pitchcraft.events.heartbeat-interval:PT30S}")
    public void heartbeat() {
        for (Stream stream : streams) {
            try {
                stream.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for session {}: {}", stream.sessionId, e.getMessage());
                close(stream);
            }
        }
    }

    SseEmitter newEmitter(long timeout) {
        return new SseEmitter(timeout);
    }

    private void forward(Stream stream, PitchEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("session_id", event.sessionId());
        if (event.phase() != null) {
            data.put("phase", event.phase());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            stream.emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping event {} for session {}: {}", event.eventType(), event.sessionId(), e.getMessage());
            close(stream);
            return;
        }
        if (ends(event)) {
            stream.emitter.complete();
            close(stream);
        }
    }

    private static boolean ends(PitchEvent event) {
        if (PitchEvent.SESSION_DELETED.equals(event.eventType())
                || PitchEvent.SESSION_EVICTED.equals(event.eventType())) {
            return true;
        }
        return event.phase() != null && Phase.valueOf(event.phase()).isTerminal();
    }

    private void close(Stream stream) {
        if (streams.remove(stream)) {
            stream.subscription.unsubscribe();
            log.debug("Event stream closed for session {}", stream.sessionId);
        }
    }

    private static final class Stream {
        private final String sessionId;
        private final SseEmitter emitter;
        private EventBus.Subscription subscription;

        private Stream(String sessionId, SseEmitter emitter) {
            this.sessionId = sessionId;
            this.emitter = emitter;
        }
    }
}
