package com.herzen.maxviews.api;

import com.herzen.maxviews.overrides.OverrideModels;
import com.herzen.maxviews.overrides.OverrideService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api")
public class OverrideController {
    private final OverrideService overrideService;

    public OverrideController(OverrideService overrideService) {
        this.overrideService = overrideService;
    }

    @GetMapping("/courses/{courseId}/overrides")
    public ResponseEntity<OverrideModels.CourseOverridesResponse> list(@PathVariable String courseId) {
        return ResponseEntity.ok(overrideService.listCourseOverrides(courseId));
    }

    @PutMapping("/modules/{moduleId}/overrides/{userId}")
    public ResponseEntity<OverrideModels.OverrideView> save(@PathVariable String moduleId,
                                                            @PathVariable String userId,
                                                            @RequestBody OverrideModels.SaveOverrideRequest request) {
        return ResponseEntity.ok(overrideService.saveOverride(moduleId, userId, request.limitDelta(), request.resetTimestamp()));
    }

    @PostMapping("/modules/{moduleId}/overrides/{userId}/reset")
    public ResponseEntity<OverrideModels.OverrideView> reset(@PathVariable String moduleId,
                                                             @PathVariable String userId) {
        return ResponseEntity.ok(overrideService.resetViews(moduleId, userId, Instant.now()));
    }

    @DeleteMapping("/modules/{moduleId}/overrides/{userId}")
    public ResponseEntity<Void> delete(@PathVariable String moduleId, @PathVariable String userId) {
        return overrideService.deleteOverride(moduleId, userId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
