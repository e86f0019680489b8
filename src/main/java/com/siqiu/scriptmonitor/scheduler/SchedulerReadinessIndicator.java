package com.siqiu.scriptmonitor.scheduler;

import com.siqiu.scriptmonitor.schedule.ScheduleRepository;
import com.siqiu.scriptmonitor.worker.ExecutionCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("scheduler")
public class SchedulerReadinessIndicator implements HealthIndicator {

    private final ScheduleRepository repository;
    private final TriggerScheduler scheduler;
    private final ExecutionCoordinator coordinator;

    public SchedulerReadinessIndicator(
            ScheduleRepository repository,
            TriggerScheduler scheduler,
            ExecutionCoordinator coordinator
    ) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        try {
            // schedule store reachable
            repository.count();
            return Health.up()
                    .withDetail("loadedSchedules", scheduler.loadedSchedules())
                    .withDetail("inFlight", coordinator.inFlight())
                    .withDetail("poolSize", coordinator.poolSize())
                    .withDetail("queued", coordinator.queued())
                    .withDetail("saturated", coordinator.inFlight() >= coordinator.poolSize())
                    .build();
        } catch (Exception e) {
            return Health.down(e)
                    .withDetail("scheduler", "not_ready")
                    .build();
        }
    }
}
