package com.conveyor.orchestrator.monitoring;

import com.conveyor.orchestrator.pipeline.PipelineCatalog;
import com.conveyor.orchestrator.service.RunCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Contributes the engine to /actuator/health: in-flight runs and the
 * configured pipelines. The engine is UP as long as at least one pipeline is
 * configured.
 */
@Component
public class RunCoordinatorHealthIndicator implements HealthIndicator {

    private final RunCoordinator  coordinator;
    private final PipelineCatalog catalog;

    public RunCoordinatorHealthIndicator(RunCoordinator coordinator, PipelineCatalog catalog) {
        this.coordinator = coordinator;
        this.catalog     = catalog;
    }

    @Override
    public Health health() {
        Health.Builder builder = catalog.names().isEmpty() ? Health.outOfService() : Health.up();
        return builder
                .withDetail("activeRuns", coordinator.activeCount())
                .withDetail("pipelines", catalog.names())
                .build();
    }
}
