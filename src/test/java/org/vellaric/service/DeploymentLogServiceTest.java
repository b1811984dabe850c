package org.vellaric.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.vellaric.config.DeployProperties;
import org.vellaric.dto.DeploymentLogEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeploymentLogServiceTest {

    private DeployProperties properties;

    private MutableClock clock;

    private DeploymentLogService logService;

    @BeforeEach
    void setUp() {
        properties = new DeployProperties();
        properties.setLogsPerDeployment(3);
        properties.setRetention(Duration.ofMinutes(30));
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        logService = new DeploymentLogService(properties, clock);
    }

    @Test
    void keepsOnlyTheMostRecentEntries() {
        for (int i = 1; i <= 5; i++) {
            logService.info("d1", "step " + i);
        }

        List<DeploymentLogEntry> logs = logService.getLogs("d1");
        assertEquals(3, logs.size());
        assertEquals("step 3", logs.get(0).getMessage());
        assertEquals("step 5", logs.get(2).getMessage());
    }

    @Test
    void levelsAreRecorded() {
        logService.warn("d1", "slow");
        logService.error("d1", "boom");

        List<DeploymentLogEntry> logs = logService.getLogs("d1");
        assertEquals(DeploymentLogService.WARN, logs.get(0).getLevel());
        assertEquals(DeploymentLogService.ERROR, logs.get(1).getLevel());
    }

    @Test
    void completedLogsExpireAfterRetention() {
        logService.info("d1", "done");
        logService.info("d2", "still running");
        logService.markCompleted("d1");

        clock.advance(Duration.ofMinutes(29));
        assertEquals(1, logService.getLogs("d1").size());

        clock.advance(Duration.ofMinutes(2));
        assertTrue(logService.getLogs("d1").isEmpty());
        assertEquals(1, logService.getLogs("d2").size());
    }

    @Test
    void unknownDeploymentHasNoLogs() {
        assertTrue(logService.getLogs("missing").isEmpty());
    }

    static class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
