package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.api.dto.PipelineResponse;
import com.conveyor.orchestrator.service.RunService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** GET /pipelines: the configured pipeline definitions. */
@RestController
@RequestMapping("/pipelines")
public class PipelineController {

    private final RunService runService;

    public PipelineController(RunService runService) {
        this.runService = runService;
    }

    @GetMapping
    public List<PipelineResponse> list() {
        return runService.pipelines().stream().map(PipelineResponse::from).toList();
    }
}
