package com.pitchcraft.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pitchcraft.core.model.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed {@link SessionStore} that keeps each session as a JSON document.
 * <p>
 * One row per session in {@code pitch_sessions}; the phase and timestamps are
 * duplicated into columns for listing and eviction. Writes use UPDATE-then-INSERT
 * inside a transaction so the same SQL runs on PostgreSQL and H2.
 */
public class JdbcSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionStore.class);

    static final String TABLE_NAME = "pitch_sessions";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          VARCHAR(64) NOT NULL PRIMARY KEY,
                phase       VARCHAR(32) NOT NULL,
                created_at  TIMESTAMP NOT NULL,
                updated_at  TIMESTAMP NOT NULL,
                payload     TEXT NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, phase, created_at, updated_at, payload)
            VALUES (?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET phase = ?, updated_at = ?, payload = ?
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT payload FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT payload FROM %s ORDER BY created_at ASC
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_IDLE_SQL = """
            DELETE FROM %s WHERE id = ? AND updated_at < ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcSessionStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Creates the session table if it does not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Session table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public String create() {
        return UUID.randomUUID().toString();
    }

    @Override
    public Optional<Session> get(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(deserialize(rs.getString(1)));
                }
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to read session " + id, e);
        }
        return Optional.empty();
    }

    @Override
    public void put(String id, Session session) {
        String json = serialize(session);
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                int updated;
                try (PreparedStatement update = conn.prepareStatement(UPDATE_SQL)) {
                    update.setString(1, session.phase().name());
                    update.setTimestamp(2, Timestamp.from(session.updatedAt()));
                    update.setString(3, json);
                    update.setString(4, id);
                    updated = update.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                        insert.setString(1, id);
                        insert.setString(2, session.phase().name());
                        insert.setTimestamp(3, Timestamp.from(session.createdAt()));
                        insert.setTimestamp(4, Timestamp.from(session.updatedAt()));
                        insert.setString(5, json);
                        insert.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to write session " + id, e);
        }
        log.debug("Saved session '{}' in phase {}", id, session.phase());
    }

    @Override
    public void delete(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to delete session " + id, e);
        }
    }

    @Override
    public List<Session> list() {
        List<Session> sessions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                sessions.add(deserialize(rs.getString(1)));
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to list sessions", e);
        }
        return sessions;
    }

    @Override
    public boolean evictIfIdle(String id, Instant cutoff) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement delete = conn.prepareStatement(DELETE_IDLE_SQL)) {
            delete.setString(1, id);
            delete.setTimestamp(2, Timestamp.from(cutoff));
            return delete.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to evict session " + id, e);
        }
    }

    private String serialize(Session session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to serialize session " + session.id(), e);
        }
    }

    private Session deserialize(String json) {
        try {
            return objectMapper.readValue(json, Session.class);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to deserialize session", e);
        }
    }
}
