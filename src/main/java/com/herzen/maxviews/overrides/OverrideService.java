package com.herzen.maxviews.overrides;

import com.herzen.maxviews.domain.ModuleNotFoundException;
import com.herzen.maxviews.overrides.OverrideModels.*;
import com.herzen.maxviews.repository.CourseModuleJdbcRepository;
import com.herzen.maxviews.repository.OverrideJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
public class OverrideService {
    private static final Logger log = LoggerFactory.getLogger(OverrideService.class);

    private final OverrideJdbcRepository repository;
    private final CourseModuleJdbcRepository moduleRepository;

    public OverrideService(OverrideJdbcRepository repository, CourseModuleJdbcRepository moduleRepository) {
        this.repository = repository;
        this.moduleRepository = moduleRepository;
    }

    public CourseOverridesResponse listCourseOverrides(String courseId) {
        return new CourseOverridesResponse(courseId, repository.loadCourseOverrides(courseId).stream()
                .map(this::toView)
                .toList());
    }

    public OverrideView saveOverride(String moduleId, String userId, Integer limitDelta, Long resetTimestamp) {
        requireModule(moduleId);
        if (resetTimestamp != null && !OverrideModels.isValidResetTimestamp(resetTimestamp)) {
            throw new InvalidOverrideException("Reset timestamp out of range: " + resetTimestamp);
        }
        OverrideRecord record = new OverrideRecord(moduleId, userId,
                limitDelta == null ? 0 : limitDelta,
                resetTimestamp == null ? 0L : resetTimestamp);
        repository.upsert(record);
        log.info("Saved views override for module {} user {}: delta={}, reset={}", moduleId, userId,
                record.limitDelta(), record.resetTimestamp());
        return toView(record);
    }

    // Keeps the stored delta.
    public OverrideView resetViews(String moduleId, String userId, Instant now) {
        requireModule(moduleId);
        repository.resetWindow(moduleId, userId, now.getEpochSecond());
        log.info("Reset views of module {} user {} at {}", moduleId, userId, now);
        return repository.find(moduleId, userId)
                .map(this::toView)
                .orElseGet(() -> new OverrideView(moduleId, userId, 0, now));
    }

    public boolean deleteOverride(String moduleId, String userId) {
        boolean deleted = repository.delete(moduleId, userId);
        if (deleted) {
            log.info("Removed views override for module {} user {}", moduleId, userId);
        }
        return deleted;
    }

    private void requireModule(String moduleId) {
        if (moduleRepository.findModule(moduleId).isEmpty()) {
            throw new ModuleNotFoundException(moduleId);
        }
    }

    private OverrideView toView(OverrideRecord record) {
        return new OverrideView(record.moduleId(), record.userId(), record.delta(), record.resetInstant());
    }
}
