package com.herzen.entanglement.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class GraphSnapshotJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public GraphSnapshotJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(SnapshotRow row) {
        jdbcTemplate.update(
                "MERGE INTO graph_snapshots(course_id, user_key, snapshot_version, payload, updated_at) KEY(course_id, user_key) VALUES (?,?,?,?,?)",
                row.courseId(), userKey(row.userId()), row.version(), row.payload(), row.updatedAt().toString());
    }

    public Optional<SnapshotRow> load(String courseId, String userId) {
        List<SnapshotRow> rows = jdbcTemplate.query(
                "SELECT course_id, user_key, snapshot_version, payload, updated_at FROM graph_snapshots WHERE course_id = ? AND user_key = ?",
                (rs, n) -> new SnapshotRow(rs.getString(1), userId(rs.getString(2)), rs.getInt(3), rs.getString(4),
                        Instant.parse(rs.getString(5))),
                courseId, userKey(userId));
        return rows.stream().findFirst();
    }

    // anonymous learners share the empty key; primary key columns cannot be null
    private static String userKey(String userId) {
        return userId == null ? "" : userId;
    }

    private static String userId(String userKey) {
        return userKey == null || userKey.isEmpty() ? null : userKey;
    }

    public record SnapshotRow(String courseId, String userId, int version, String payload, Instant updatedAt) {}
}
