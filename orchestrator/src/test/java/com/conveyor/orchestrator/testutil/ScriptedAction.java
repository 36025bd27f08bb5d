package com.conveyor.orchestrator.testutil;

import com.conveyor.orchestrator.model.StageSpec;
import com.conveyor.orchestrator.stage.ActionOutcome;
import com.conveyor.orchestrator.stage.StageAction;
import com.conveyor.orchestrator.stage.StageContext;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test action of type "scripted". Each stage name gets a queue of behaviours,
 * consumed one per attempt; the last one repeats. Stages without a script
 * succeed at once.
 *
 * Also records which stages started, how often, and how many attempts ran at
 * the same time.
 */
public class ScriptedAction implements StageAction {

    public static final String TYPE = "scripted";

    @FunctionalInterface
    public interface Behaviour {
        ActionOutcome perform(StageContext ctx) throws Exception;
    }

    private final Map<String, Deque<Behaviour>> scripts  = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger>    attempts = new ConcurrentHashMap<>();
    private final List<String>                  started  = new CopyOnWriteArrayList<>();
    private final AtomicInteger                 running  = new AtomicInteger();
    private final AtomicInteger                 maxRunning = new AtomicInteger();

    public ScriptedAction script(String stage, Behaviour... behaviours) {
        scripts.put(stage, new ArrayDeque<>(List.of(behaviours)));
        return this;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public ActionOutcome perform(StageSpec spec, StageContext ctx) throws Exception {
        started.add(spec.name());
        attempts.computeIfAbsent(spec.name(), k -> new AtomicInteger()).incrementAndGet();
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            return next(spec.name()).perform(ctx);
        } finally {
            running.decrementAndGet();
        }
    }

    private Behaviour next(String stage) {
        Deque<Behaviour> script = scripts.get(stage);
        if (script == null || script.isEmpty()) {
            return ctx -> ActionOutcome.succeeded(stage + " ok");
        }
        synchronized (script) {
            return script.size() > 1 ? script.poll() : script.peek();
        }
    }

    public int attemptsOf(String stage) {
        AtomicInteger n = attempts.get(stage);
        return n == null ? 0 : n.get();
    }

    public List<String> started() {
        return List.copyOf(started);
    }

    public int maxConcurrent() {
        return maxRunning.get();
    }

    // ------------------------------------------------------------------
    // Common behaviours
    // ------------------------------------------------------------------

    public static Behaviour succeed() {
        return ctx -> ActionOutcome.succeeded("ok");
    }

    public static Behaviour fail(String output) {
        return ctx -> ActionOutcome.failed(output);
    }

    /** Blocks until interrupted (timeout or cancellation). */
    public static Behaviour hang() {
        return ctx -> {
            Thread.sleep(60_000);
            return ActionOutcome.succeeded("woke up");
        };
    }

    public static Behaviour sleepThenSucceed(long millis) {
        return ctx -> {
            Thread.sleep(millis);
            return ActionOutcome.succeeded("slept " + millis + "ms");
        };
    }
}
