package com.conveyor.orchestrator.service;

/** Where the coordinator announces finished runs. */
@FunctionalInterface
public interface RunEventPublisher {

    void publish(RunCompletedEvent event);
}
