package com.conveyor.orchestrator.service;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Delivers run events through the Spring context, to every
 * {@code @EventListener} of {@link RunCompletedEvent}. Listeners run
 * synchronously on the run's driver thread.
 */
@Component
public class SpringRunEventPublisher implements RunEventPublisher {

    private final ApplicationEventPublisher publisher;

    public SpringRunEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publish(RunCompletedEvent event) {
        publisher.publishEvent(event);
    }
}
