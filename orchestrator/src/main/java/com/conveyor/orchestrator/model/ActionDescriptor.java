package com.conveyor.orchestrator.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Names the action a stage performs and carries its arguments.
 *
 * @param type   registered action type: "command", "publish", "deploy" or "verify"
 * @param args   positional arguments; the command line for "command" actions
 * @param params named parameters (artifact name, workload, selector, env.* variables ...)
 */
public record ActionDescriptor(String type, List<String> args, Map<String, String> params) {

    public ActionDescriptor {
        Objects.requireNonNull(type, "type");
        args   = args   == null ? List.of() : List.copyOf(args);
        params = params == null ? Map.of()  : Map.copyOf(params);
    }

    public static ActionDescriptor command(String... commandLine) {
        return new ActionDescriptor("command", List.of(commandLine), Map.of());
    }

    public static ActionDescriptor of(String type, Map<String, String> params) {
        return new ActionDescriptor(type, List.of(), params);
    }

    public String param(String name) {
        return params.get(name);
    }

    public String param(String name, String fallback) {
        return params.getOrDefault(name, fallback);
    }
}
