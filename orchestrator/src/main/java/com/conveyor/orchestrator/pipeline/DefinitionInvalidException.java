package com.conveyor.orchestrator.pipeline;

import java.util.List;

/**
 * Thrown when a pipeline definition cannot be run: a dependency cycle, a
 * dependency on an unknown stage, a duplicate stage name, or an action that
 * no registered {@code StageAction} can perform.
 *
 * Raised before any stage executes; no Run is created.
 */
public class DefinitionInvalidException extends RuntimeException {

    private final String       pipeline;
    private final List<String> problems;

    public DefinitionInvalidException(String pipeline, List<String> problems) {
        super("Pipeline '" + pipeline + "' is invalid: " + String.join("; ", problems));
        this.pipeline = pipeline;
        this.problems = List.copyOf(problems);
    }

    public String       getPipeline() { return pipeline; }
    public List<String> getProblems() { return problems; }
}
