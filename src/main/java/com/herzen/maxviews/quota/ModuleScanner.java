package com.herzen.maxviews.quota;

import com.herzen.maxviews.config.MaxViewsProperties;
import com.herzen.maxviews.domain.DomainModels.CourseModule;
import com.herzen.maxviews.repository.CourseModuleJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class ModuleScanner {
    private static final Logger log = LoggerFactory.getLogger(ModuleScanner.class);

    private final CourseModuleJdbcRepository repository;
    private final MaxViewsProperties properties;

    public ModuleScanner(CourseModuleJdbcRepository repository, MaxViewsProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public Set<String> findRestrictedVisibleItems(String courseId, String userId) {
        Set<String> restricted = repository.loadCourseModules(courseId).stream()
                .filter(CourseModule::visible)
                .filter(this::hasViewLimit)
                .map(CourseModule::id)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        log.debug("Course {} has {} view-limited modules visible to user {}", courseId, restricted.size(), userId);
        return restricted;
    }

    private boolean hasViewLimit(CourseModule module) {
        return module.availability() != null && module.availability().contains(properties.conditionType());
    }
}
