package com.herzen.maxviews.api;

import com.herzen.maxviews.quota.ModuleScanner;
import com.herzen.maxviews.quota.QuotaEvaluator;
import com.herzen.maxviews.quota.QuotaModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

@RestController
@RequestMapping("/api")
public class QuotaController {
    private final QuotaEvaluator quotaEvaluator;
    private final ModuleScanner moduleScanner;

    public QuotaController(QuotaEvaluator quotaEvaluator, ModuleScanner moduleScanner) {
        this.quotaEvaluator = quotaEvaluator;
        this.moduleScanner = moduleScanner;
    }

    @GetMapping("/courses/{courseId}/views")
    public ResponseEntity<QuotaModels.CourseViewsReport> courseViews(@PathVariable String courseId,
                                                                     @RequestParam String userId) {
        return ResponseEntity.ok(quotaEvaluator.evaluateCourse(courseId, userId));
    }

    @GetMapping("/courses/{courseId}/restricted-modules")
    public ResponseEntity<Set<String>> restrictedModules(@PathVariable String courseId,
                                                         @RequestParam String userId) {
        return ResponseEntity.ok(moduleScanner.findRestrictedVisibleItems(courseId, userId));
    }

    @GetMapping("/modules/{moduleId}/views")
    public ResponseEntity<ModuleViewsResponse> moduleViews(@PathVariable String moduleId,
                                                           @RequestParam String userId) {
        return quotaEvaluator.evaluateModule(moduleId, userId)
                .map(result -> ResponseEntity.ok(new ModuleViewsResponse(moduleId, userId, result, result.status())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    public record ModuleViewsResponse(String moduleId,
                                      String userId,
                                      QuotaModels.QuotaResult result,
                                      QuotaModels.ViewStatus status) {}
}
