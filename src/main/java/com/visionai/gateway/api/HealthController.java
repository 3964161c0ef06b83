package com.visionai.gateway.api;

import com.visionai.gateway.events.EventManager;
import com.visionai.gateway.events.ManagerStatus;
import com.visionai.gateway.gateway.GatewayHealthService;
import com.visionai.gateway.gateway.HealthDocument;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Read-only probes: composite health for load balancers, event manager status for operators.
 */
@RestController
public class HealthController {

    private final GatewayHealthService healthService;
    private final EventManager eventManager;

    public HealthController(GatewayHealthService healthService, EventManager eventManager) {
        this.healthService = healthService;
        this.eventManager = eventManager;
    }

    /** 200 when healthy, 503 when degraded or unhealthy. */
    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<HealthDocument>> health() {
        return healthService.health()
                .map(doc -> ResponseEntity
                        .status(doc.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                        .body(doc));
    }

    @GetMapping(path = "/api/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public ManagerStatus status() {
        return eventManager.getStatus();
    }
}
