package com.swab.backend.global.status;

import java.time.Clock;
import java.time.Instant;

import com.swab.backend.modules.scheduler.application.NotificationSchedulerEngine;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service banner plus liveness and readiness probes.
 */
@RestController
@ConditionalOnWebApplication
public class StatusController {

    private static final String SERVICE_NAME = "SWAB Server API";

    private final HealthEndpoint healthEndpoint;
    private final NotificationSchedulerEngine engine;
    private final Clock clock;
    private final String version;

    public StatusController(
            HealthEndpoint healthEndpoint,
            NotificationSchedulerEngine engine,
            Clock clock,
            @Value("${swab.version:1.0.0}") String version
    ) {
        this.healthEndpoint = healthEndpoint;
        this.engine = engine;
        this.clock = clock;
        this.version = version;
    }

    @GetMapping("/")
    public StatusResponse status() {
        return new StatusResponse(SERVICE_NAME, version, "running", engine.count(), engine.state().name());
    }

    /**
     * Liveness: the process answers.
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", Instant.now(clock).toString());
    }

    /**
     * Readiness: aggregated Actuator health, including the database and the scheduler.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        String status;
        try {
            HealthComponent health = healthEndpoint.health();
            status = health.getStatus().getCode();
        } catch (RuntimeException ex) {
            status = Status.DOWN.getCode();
        }
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, Instant.now(clock).toString()));
    }

    public record StatusResponse(
            String name,
            String version,
            String status,
            int scheduledJobs,
            String schedulerState
    ) {
    }

    public record HealthResponse(
            String status,   // "UP" | "DOWN"
            String timestamp // ISO-8601
    ) {
    }
}
