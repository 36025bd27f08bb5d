package com.conveyor.orchestrator.platform;

import com.conveyor.orchestrator.platform.dto.ApplyWorkloadRequest;
import com.conveyor.orchestrator.platform.dto.WorkloadStatusResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for the deployment platform.
 *
 * POST /workloads                      apply a desired workload spec
 * GET  /workloads/{selector}/status   desired vs. ready replicas
 */
@Component
public class HttpDeploymentPlatformClient extends JsonHttpClient implements DeploymentPlatform {

    private static final Logger log = LoggerFactory.getLogger(HttpDeploymentPlatformClient.class);

    public HttpDeploymentPlatformClient(@Value("${conveyor.platform.base-url:http://localhost:8082}") String baseUrl,
                                        @Value("${conveyor.http.request-timeout:30s}") Duration requestTimeout,
                                        ObjectMapper objectMapper) {
        super(baseUrl, requestTimeout, objectMapper);
    }

    @Override
    public Receipt apply(WorkloadSpec spec) {
        log.info("Applying workload '{}' image={} replicas={}", spec.name(), spec.image(), spec.replicas());
        String opName = "apply workload " + spec.name();
        try {
            HttpResponse<String> resp = post("/workloads", new ApplyWorkloadRequest(
                    spec.name(), spec.image(), spec.replicas(), spec.selector(), spec.labels()), opName);
            return toReceipt(resp, opName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformException(opName + " interrupted", e);
        }
    }

    @Override
    public WorkloadStatus status(String selector) {
        String opName = "status of " + selector;
        try {
            HttpResponse<String> resp = get("/workloads/"
                    + URLEncoder.encode(selector, StandardCharsets.UTF_8) + "/status", opName);
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new PlatformException(opName + " failed with HTTP " + resp.statusCode() + ": " + resp.body());
            }
            WorkloadStatusResponse body = parse(resp, WorkloadStatusResponse.class, opName);
            return new WorkloadStatus(body.desired_replicas(), body.ready_replicas(), body.last_error());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformException(opName + " interrupted", e);
        }
    }
}
