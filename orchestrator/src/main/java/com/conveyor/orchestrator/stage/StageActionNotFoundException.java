package com.conveyor.orchestrator.stage;

public class StageActionNotFoundException extends RuntimeException {
    public StageActionNotFoundException(String type) {
        super("No stage action registered for type: '" + type + "'");
    }
}
