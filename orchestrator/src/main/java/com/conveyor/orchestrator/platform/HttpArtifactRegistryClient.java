package com.conveyor.orchestrator.platform;

import com.conveyor.orchestrator.platform.dto.PublishArtifactRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the artifact registry.
 *
 * POST /artifacts {name, version, payload_ref}
 */
@Component
public class HttpArtifactRegistryClient extends JsonHttpClient implements ArtifactRegistry {

    private static final Logger log = LoggerFactory.getLogger(HttpArtifactRegistryClient.class);

    public HttpArtifactRegistryClient(@Value("${conveyor.registry.base-url:http://localhost:8081}") String baseUrl,
                                      @Value("${conveyor.http.request-timeout:30s}") Duration requestTimeout,
                                      ObjectMapper objectMapper) {
        super(baseUrl, requestTimeout, objectMapper);
    }

    @Override
    public Receipt publish(String name, String version, String payloadRef) {
        log.info("Publishing artifact {}:{} from {}", name, version, payloadRef);
        String opName = "publish " + name + ":" + version;
        try {
            HttpResponse<String> resp = post("/artifacts",
                    new PublishArtifactRequest(name, version, payloadRef), opName);
            Receipt receipt = toReceipt(resp, opName);
            if (!receipt.accepted()) {
                log.warn("Registry rejected {}:{}: {}", name, version, receipt.reason());
            }
            return receipt;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformException(opName + " interrupted", e);
        }
    }
}
