package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.model.HealthCheckPolicy;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.PipelineKind;
import com.conveyor.orchestrator.model.StageClassification;
import com.conveyor.orchestrator.service.RunService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.conveyor.orchestrator.testutil.TestPipelines.pipeline;
import static com.conveyor.orchestrator.testutil.TestPipelines.scripted;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

    @Autowired MockMvc      mockMvc;
    @MockitoBean RunService runService;

    @Test
    void list_returnsConfiguredPipelines() throws Exception {
        PipelineDefinition ci = pipeline("ci", scripted("build"), scripted("test", StageClassification.TEST, "build"));
        PipelineDefinition cd = new PipelineDefinition("cd", "2", PipelineKind.CD,
                List.of(scripted("deploy", StageClassification.DEPLOY)), HealthCheckPolicy.defaults("app=web-api"));
        when(runService.pipelines()).thenReturn(List.of(ci, cd));

        mockMvc.perform(get("/pipelines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("ci"))
                .andExpect(jsonPath("$[0].kind").value("CI"))
                .andExpect(jsonPath("$[0].stages[1].dependsOn[0]").value("build"))
                .andExpect(jsonPath("$[0].stages[1].timeout").value("PT30S"))
                .andExpect(jsonPath("$[1].healthCheckSelector").value("app=web-api"));
    }
}
