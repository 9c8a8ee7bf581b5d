package com.herzen.maxviews;

import com.herzen.maxviews.domain.ModuleNotFoundException;
import com.herzen.maxviews.overrides.InvalidOverrideException;
import com.herzen.maxviews.overrides.OverrideService;
import com.herzen.maxviews.quota.QuotaEvaluator;
import com.herzen.maxviews.quota.QuotaModels.QuotaResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class OverrideServiceTest {
    @Autowired
    private OverrideService overrideService;
    @Autowired
    private QuotaEvaluator evaluator;
    @Autowired
    private JdbcTemplate jdbc;

    @Test
    void savedOverrideRaisesTheLimit() {
        QuotaFixtures.course(jdbc, "ov-1");
        QuotaFixtures.module(jdbc, "ov-1", "ov-1-m", true, QuotaFixtures.viewLimit(2));
        QuotaFixtures.views(jdbc, "ov-1-m", "u1", 10, 20);
        assertEquals(0, evaluator.evaluateModule("ov-1-m", "u1").orElseThrow().viewsRemaining());

        var saved = overrideService.saveOverride("ov-1-m", "u1", 3, null);
        assertEquals(3, saved.limitDelta());
        assertNull(saved.resetAt());

        QuotaResult result = evaluator.evaluateModule("ov-1-m", "u1").orElseThrow();
        assertEquals(5, result.viewsLimit());
        assertEquals(3, result.viewsRemaining());
    }

    @Test
    void resetKeepsExtraViewsAndDropsEarlierViews() {
        QuotaFixtures.course(jdbc, "ov-2");
        QuotaFixtures.module(jdbc, "ov-2", "ov-2-m", true, QuotaFixtures.viewLimit(2));
        QuotaFixtures.views(jdbc, "ov-2-m", "u1", 10, 20, 30);
        overrideService.saveOverride("ov-2-m", "u1", 1, null);

        Instant now = Instant.ofEpochSecond(25);
        var reset = overrideService.resetViews("ov-2-m", "u1", now);
        assertEquals(1, reset.limitDelta());
        assertEquals(now, reset.resetAt());

        QuotaResult result = evaluator.evaluateModule("ov-2-m", "u1").orElseThrow();
        assertEquals(1, result.viewsCount());
        assertEquals(3, result.viewsLimit());
    }

    @Test
    void resetWithoutStoredOverrideCreatesOne() {
        QuotaFixtures.course(jdbc, "ov-5");
        QuotaFixtures.module(jdbc, "ov-5", "ov-5-m", true, QuotaFixtures.viewLimit(2));
        QuotaFixtures.views(jdbc, "ov-5-m", "u1", 10, 20, 30);

        Instant now = Instant.ofEpochSecond(20);
        var reset = overrideService.resetViews("ov-5-m", "u1", now);
        assertEquals(0, reset.limitDelta());
        assertEquals(now, reset.resetAt());

        QuotaResult result = evaluator.evaluateModule("ov-5-m", "u1").orElseThrow();
        assertEquals(2, result.viewsCount());
        assertEquals(2, result.viewsLimit());
        assertEquals(1, overrideService.listCourseOverrides("ov-5").overrides().size());
    }

    @Test
    void listsOverridesOfTheCourse() {
        QuotaFixtures.course(jdbc, "ov-3");
        QuotaFixtures.module(jdbc, "ov-3", "ov-3-a", true, QuotaFixtures.viewLimit(2));
        QuotaFixtures.module(jdbc, "ov-3", "ov-3-b", true, QuotaFixtures.viewLimit(2));
        overrideService.saveOverride("ov-3-a", "u1", 2, null);
        overrideService.saveOverride("ov-3-b", "u2", null, 500L);

        var listed = overrideService.listCourseOverrides("ov-3");
        assertEquals(2, listed.overrides().size());
        assertEquals("ov-3-a", listed.overrides().get(0).moduleId());
        assertEquals(2, listed.overrides().get(0).limitDelta());
        assertEquals(0, listed.overrides().get(1).limitDelta());
        assertEquals(Instant.ofEpochSecond(500), listed.overrides().get(1).resetAt());

        assertTrue(overrideService.deleteOverride("ov-3-a", "u1"));
        assertFalse(overrideService.deleteOverride("ov-3-a", "u1"));
        assertEquals(1, overrideService.listCourseOverrides("ov-3").overrides().size());
    }

    @Test
    void rejectsUnknownModule() {
        assertThrows(ModuleNotFoundException.class, () -> overrideService.saveOverride("ov-missing", "u1", 1, null));
        assertThrows(ModuleNotFoundException.class, () -> overrideService.resetViews("ov-missing", "u1", Instant.now()));
    }

    @Test
    void rejectsResetOutsideTheTimeRange() {
        QuotaFixtures.course(jdbc, "ov-4");
        QuotaFixtures.module(jdbc, "ov-4", "ov-4-m", true, QuotaFixtures.viewLimit(2));

        assertThrows(InvalidOverrideException.class, () -> overrideService.saveOverride("ov-4-m", "u1", 1, Long.MAX_VALUE));
        assertThrows(InvalidOverrideException.class, () -> overrideService.saveOverride("ov-4-m", "u1", 1, -1L));
        assertTrue(overrideService.listCourseOverrides("ov-4").overrides().isEmpty());
    }

    @Test
    void storedOutOfRangeResetIsTreatedAsUnset() {
        QuotaFixtures.course(jdbc, "ov-6");
        QuotaFixtures.module(jdbc, "ov-6", "ov-6-m", true, QuotaFixtures.viewLimit(3));
        QuotaFixtures.views(jdbc, "ov-6-m", "u1", 10, 20);
        QuotaFixtures.override(jdbc, "ov-6-m", "u1", 1, Long.MAX_VALUE);

        var listed = overrideService.listCourseOverrides("ov-6");
        assertEquals(1, listed.overrides().size());
        assertEquals(1, listed.overrides().get(0).limitDelta());
        assertNull(listed.overrides().get(0).resetAt());

        QuotaResult result = evaluator.evaluateModule("ov-6-m", "u1").orElseThrow();
        assertEquals(2, result.viewsCount());
        assertEquals(4, result.viewsLimit());
    }
}
