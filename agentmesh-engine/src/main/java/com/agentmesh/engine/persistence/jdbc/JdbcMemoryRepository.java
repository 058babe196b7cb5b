package com.agentmesh.engine.persistence.jdbc;

import com.agentmesh.core.exception.VersionConflictException;
import com.agentmesh.core.model.MemoryEntry;
import com.agentmesh.core.repository.MemoryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of MemoryRepository.
 *
 * Versions are allocated as MAX(version) + 1 inside the insert. The
 * (scope_key, version) primary key turns a lost race into a duplicate-key
 * error: unconditional appends retry, conditional appends report a conflict.
 */
@Repository("jdbcMemoryRepository")
public class JdbcMemoryRepository implements MemoryRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcMemoryRepository.class);

    private static final int MAX_APPEND_RETRIES = 16;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final MemoryEntryRowMapper rowMapper;

    public JdbcMemoryRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new MemoryEntryRowMapper(objectMapper);
    }

    @Override
    public MemoryEntry append(String scopeKey, JsonNode content, boolean tombstone, Instant writtenAt) {
        String sql = """
            INSERT INTO memory_entries (scope_key, version, content, tombstone, written_at)
            SELECT ?, COALESCE(MAX(version), 0) + 1, ?::jsonb, ?, ?
            FROM memory_entries
            WHERE scope_key = ?
            RETURNING version
            """;

        String json = serialize(content);
        for (int attempt = 1; ; attempt++) {
            try {
                Long version = jdbcTemplate.queryForObject(sql, Long.class,
                    scopeKey, json, tombstone, Timestamp.from(writtenAt), scopeKey);
                log.debug("Appended {} version {}", scopeKey, version);
                return new MemoryEntry(scopeKey, version, content, tombstone, writtenAt);
            } catch (DuplicateKeyException e) {
                if (attempt >= MAX_APPEND_RETRIES) {
                    throw new IllegalStateException(
                        "Could not allocate a version for " + scopeKey + " after " + attempt + " attempts", e);
                }
                log.debug("Version race on {}, retrying (attempt {})", scopeKey, attempt);
            }
        }
    }

    @Override
    @Transactional
    public MemoryEntry appendIfVersion(String scopeKey, long expectedVersion, JsonNode content,
                                       boolean tombstone, Instant writtenAt) {
        long actual = latestVersion(scopeKey);
        if (actual != expectedVersion) {
            throw new VersionConflictException(scopeKey, expectedVersion, actual);
        }

        String sql = """
            INSERT INTO memory_entries (scope_key, version, content, tombstone, written_at)
            VALUES (?, ?, ?::jsonb, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql, scopeKey, expectedVersion + 1, serialize(content), tombstone,
                Timestamp.from(writtenAt));
        } catch (DuplicateKeyException e) {
            // the transaction is aborted; a concurrent writer holds at least expectedVersion + 1
            throw new VersionConflictException(scopeKey, expectedVersion, expectedVersion + 1);
        }
        log.debug("Appended {} version {} (conditional)", scopeKey, expectedVersion + 1);
        return new MemoryEntry(scopeKey, expectedVersion + 1, content, tombstone, writtenAt);
    }

    @Override
    public Optional<MemoryEntry> findLatest(String scopeKey) {
        String sql = """
            SELECT * FROM memory_entries
            WHERE scope_key = ?
            ORDER BY version DESC
            LIMIT 1
            """;
        List<MemoryEntry> results = jdbcTemplate.query(sql, rowMapper, scopeKey);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<MemoryEntry> findVersion(String scopeKey, long version) {
        String sql = "SELECT * FROM memory_entries WHERE scope_key = ? AND version = ?";
        List<MemoryEntry> results = jdbcTemplate.query(sql, rowMapper, scopeKey, version);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<MemoryEntry> findVersions(String scopeKey) {
        String sql = """
            SELECT * FROM memory_entries
            WHERE scope_key = ?
            ORDER BY version ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, scopeKey);
    }

    @Override
    public List<String> findKeys(String prefix) {
        String sql = """
            SELECT DISTINCT scope_key FROM memory_entries
            WHERE scope_key LIKE ? ESCAPE '\\'
            ORDER BY scope_key
            """;
        return jdbcTemplate.queryForList(sql, String.class, escapeLike(prefix) + "%");
    }

    @Override
    @Transactional
    public int deleteVersionsBefore(String scopeKey, long version) {
        int removed = jdbcTemplate.update(
            "DELETE FROM memory_entries WHERE scope_key = ? AND version < ?", scopeKey, version);
        if (removed > 0) {
            log.debug("Compacted {} versions of {}", removed, scopeKey);
        }
        return removed;
    }

    // ========== Internal Methods ==========

    private long latestVersion(String scopeKey) {
        Long version = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(version), 0) FROM memory_entries WHERE scope_key = ?",
            Long.class, scopeKey);
        return version != null ? version : 0L;
    }

    private String serialize(JsonNode content) {
        if (content == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Memory content is not serializable", e);
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static class MemoryEntryRowMapper implements RowMapper<MemoryEntry> {

        private final ObjectMapper objectMapper;

        MemoryEntryRowMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        @Override
        public MemoryEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            String content = rs.getString("content");
            return new MemoryEntry(
                rs.getString("scope_key"),
                rs.getLong("version"),
                parse(content),
                rs.getBoolean("tombstone"),
                rs.getTimestamp("written_at").toInstant()
            );
        }

        private JsonNode parse(String json) throws SQLException {
            if (json == null) {
                return null;
            }
            try {
                return objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                throw new SQLException("Corrupt memory entry content", e);
            }
        }
    }
}
