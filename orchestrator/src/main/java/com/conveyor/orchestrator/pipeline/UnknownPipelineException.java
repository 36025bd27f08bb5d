package com.conveyor.orchestrator.pipeline;

public class UnknownPipelineException extends RuntimeException {
    public UnknownPipelineException(String name) {
        super("No pipeline configured with name: '" + name + "'");
    }
}
