package com.memquest.deadletter;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps dead letters in PostgreSQL ({@code memory_dead_letters}, see
 * {@code db/dead-letters.sql}) for manual inspection and replay. The vector is
 * not kept; a replay re-embeds the text.
 */
public class JdbcDeadLetterStore implements DeadLetterHandler {

    private static final Logger log = LoggerFactory.getLogger(JdbcDeadLetterStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;

    public JdbcDeadLetterStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public DataSource dataSource() { return dataSource; }

    @Override
    public void deadLetter(Map<String, Object> document, String reason) {
        var id = String.valueOf(document.getOrDefault("id", ""));
        var payload = new LinkedHashMap<>(document);
        payload.remove("vector");
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(
                     "INSERT INTO memory_dead_letters (doc_id, reason, payload) VALUES (?,?,?::jsonb)")) {
            ps.setString(1, id);
            ps.setString(2, reason);
            ps.setString(3, MAPPER.writeValueAsString(payload));
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to persist dead letter for document {} ({})", id, reason, e);
        }
    }

    /** Number of dead letters not yet replayed, or -1 if the table cannot be read. */
    public long pending() {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(
                     "SELECT COUNT(*) FROM memory_dead_letters WHERE replayed_at IS NULL");
             var rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (Exception e) {
            log.error("Failed to count dead letters", e);
            return -1;
        }
    }
}
