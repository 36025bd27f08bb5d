package com.conveyor.orchestrator.testutil;

import com.conveyor.orchestrator.support.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that returns at once and moves a {@link ManualClock} forward by the
 * requested duration. Every requested sleep is recorded.
 */
public class ManualSleeper implements Sleeper {

    private final ManualClock    clock;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    public ManualSleeper(ManualClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("interrupted before sleeping " + duration);
        }
        sleeps.add(duration);
        clock.advance(duration);
    }

    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }
}
