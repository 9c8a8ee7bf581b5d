package com.herzen.maxviews.repository;

import com.herzen.maxviews.overrides.OverrideModels.OverrideRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class OverrideJdbcRepository {
    private static final RowMapper<OverrideRecord> OVERRIDE_MAPPER = (rs, n) -> new OverrideRecord(
            rs.getString(1), rs.getString(2), rs.getObject(3, Integer.class), rs.getObject(4, Long.class));

    private final JdbcTemplate jdbcTemplate;

    public OverrideJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<OverrideRecord> find(String moduleId, String userId) {
        List<OverrideRecord> rows = jdbcTemplate.query(
                "SELECT cmid, userid, maxviews, lastreset FROM availability_maxviews WHERE cmid = ? AND userid = ?",
                OVERRIDE_MAPPER,
                moduleId, userId);
        return rows.stream().findFirst();
    }

    public List<OverrideRecord> loadCourseOverrides(String courseId) {
        return jdbcTemplate.query(
                "SELECT o.cmid, o.userid, o.maxviews, o.lastreset FROM availability_maxviews o " +
                        "JOIN course_modules m ON m.id = o.cmid WHERE m.course_id = ? ORDER BY o.cmid, o.userid",
                OVERRIDE_MAPPER,
                courseId);
    }

    public void upsert(OverrideRecord record) {
        jdbcTemplate.update(
                "MERGE INTO availability_maxviews(cmid, userid, maxviews, lastreset) KEY(cmid, userid) VALUES (?,?,?,?)",
                record.moduleId(), record.userId(),
                record.limitDelta() == null ? 0 : record.limitDelta(),
                record.resetTimestamp() == null ? 0L : record.resetTimestamp());
    }

    public void resetWindow(String moduleId, String userId, long resetTimestamp) {
        jdbcTemplate.update(
                "MERGE INTO availability_maxviews t USING (SELECT CAST(? AS VARCHAR(64)) AS cmid, " +
                        "CAST(? AS VARCHAR(64)) AS userid, CAST(? AS BIGINT) AS lastreset) s " +
                        "ON t.cmid = s.cmid AND t.userid = s.userid " +
                        "WHEN MATCHED THEN UPDATE SET lastreset = s.lastreset " +
                        "WHEN NOT MATCHED THEN INSERT (cmid, userid, maxviews, lastreset) " +
                        "VALUES (s.cmid, s.userid, 0, s.lastreset)",
                moduleId, userId, resetTimestamp);
    }

    public boolean delete(String moduleId, String userId) {
        return jdbcTemplate.update("DELETE FROM availability_maxviews WHERE cmid = ? AND userid = ?", moduleId, userId) > 0;
    }
}
