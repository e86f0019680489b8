package com.siqiu.scriptmonitor;

import com.siqiu.scriptmonitor.scheduler.SchedulerReadinessIndicator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {ScriptMonitorApplication.class, TestcontainersConfig.class})
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class PostgresContainerSmokeTest {

    @Autowired SchedulerReadinessIndicator readiness;

    @Test
    void contextLoads() {
        // If the app starts, Flyway ran and the entities match the schema
        assertThat(readiness.health().getStatus()).isEqualTo(Status.UP);
        assertThat(readiness.health().getDetails()).containsEntry("poolSize", 5);
    }
}
