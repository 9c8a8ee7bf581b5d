package com.herzen.maxviews.quota;

import com.herzen.maxviews.availability.AvailabilityFormatException;
import com.herzen.maxviews.availability.AvailabilityTreeParser;
import com.herzen.maxviews.availability.LimitResolver;
import com.herzen.maxviews.domain.DomainModels.CourseModule;
import com.herzen.maxviews.overrides.OverrideModels.OverrideRecord;
import com.herzen.maxviews.quota.QuotaModels.*;
import com.herzen.maxviews.repository.CourseModuleJdbcRepository;
import com.herzen.maxviews.repository.OverrideJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class QuotaEvaluator {
    private static final Logger log = LoggerFactory.getLogger(QuotaEvaluator.class);

    private final CourseModuleJdbcRepository moduleRepository;
    private final OverrideJdbcRepository overrideRepository;
    private final AvailabilityTreeParser treeParser;
    private final LimitResolver limitResolver;
    private final OverrideApplier overrideApplier;
    private final ViewCounter viewCounter;
    private final ModuleScanner moduleScanner;

    public QuotaEvaluator(CourseModuleJdbcRepository moduleRepository,
                          OverrideJdbcRepository overrideRepository,
                          AvailabilityTreeParser treeParser,
                          LimitResolver limitResolver,
                          OverrideApplier overrideApplier,
                          ViewCounter viewCounter,
                          ModuleScanner moduleScanner) {
        this.moduleRepository = moduleRepository;
        this.overrideRepository = overrideRepository;
        this.treeParser = treeParser;
        this.limitResolver = limitResolver;
        this.overrideApplier = overrideApplier;
        this.viewCounter = viewCounter;
        this.moduleScanner = moduleScanner;
    }

    public QuotaResult evaluate(CourseModule module, String userId) {
        int baseLimit = limitResolver.resolveBaseLimit(treeParser.parse(module.availability()));
        Optional<OverrideRecord> override = overrideRepository.find(module.id(), userId);
        EffectiveLimit limit = overrideApplier.applyOverride(baseLimit, override);
        long viewsCount = viewCounter.countViews(module.contextId(), userId, limit.windowStart());

        QuotaResult result = QuotaResult.of(viewsCount, limit);
        log.debug("Module {} user {}: {} of {} views used, window from {}",
                module.id(), userId, viewsCount, limit.viewsLimit(), limit.windowStart());
        return result;
    }

    public Optional<QuotaResult> evaluateModule(String moduleId, String userId) {
        return moduleRepository.findModule(moduleId).map(module -> evaluate(module, userId));
    }

    public CourseViewsReport evaluateCourse(String courseId, String userId) {
        if (!moduleRepository.courseExists(courseId)) {
            return new CourseViewsReport(courseId, userId, List.of());
        }

        Set<String> moduleIds = moduleScanner.findRestrictedVisibleItems(courseId, userId);
        List<ItemEvaluation> items = new ArrayList<>();
        for (String moduleId : moduleIds) {
            items.add(evaluateItem(moduleId, userId));
        }
        return new CourseViewsReport(courseId, userId, items);
    }

    private ItemEvaluation evaluateItem(String moduleId, String userId) {
        try {
            Optional<CourseModule> module = moduleRepository.findModule(moduleId);
            if (module.isEmpty()) {
                return ItemEvaluation.failed(moduleId, "NOT_FOUND", "Course module not found: " + moduleId);
            }
            return ItemEvaluation.evaluated(moduleId, evaluate(module.get(), userId));
        } catch (DataAccessException e) {
            log.warn("Could not evaluate views of module {} for user {}", moduleId, userId, e);
            return ItemEvaluation.failed(moduleId, "DATA_ACCESS", "Views could not be computed");
        } catch (AvailabilityFormatException e) {
            log.warn("Module {} has malformed availability: {}", moduleId, e.getMessage());
            return ItemEvaluation.failed(moduleId, "MALFORMED_AVAILABILITY", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure evaluating views of module {} for user {}", moduleId, userId, e);
            return ItemEvaluation.failed(moduleId, "INTERNAL_ERROR", e.getMessage());
        }
    }
}
