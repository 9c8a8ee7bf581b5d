package com.herzen.maxviews.repository;

import com.herzen.maxviews.domain.DomainModels.CourseModule;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class CourseModuleJdbcRepository {
    private static final RowMapper<CourseModule> MODULE_MAPPER = (rs, n) -> new CourseModule(
            rs.getString(1), rs.getString(2), rs.getString(3), rs.getBoolean(4), rs.getString(5));

    private final JdbcTemplate jdbcTemplate;

    public CourseModuleJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean courseExists(String courseId) {
        Long value = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM courses WHERE id = ?",
                Long.class,
                courseId);
        return value != null && value > 0;
    }

    public List<CourseModule> loadCourseModules(String courseId) {
        return jdbcTemplate.query(
                "SELECT id, course_id, context_id, visible, availability FROM course_modules WHERE course_id = ? ORDER BY id",
                MODULE_MAPPER,
                courseId);
    }

    public Optional<CourseModule> findModule(String moduleId) {
        List<CourseModule> rows = jdbcTemplate.query(
                "SELECT id, course_id, context_id, visible, availability FROM course_modules WHERE id = ?",
                MODULE_MAPPER,
                moduleId);
        return rows.stream().findFirst();
    }
}
