package com.swab.backend.modules.scheduler.presentation;

import java.util.List;

import com.swab.backend.global.error.ProblemException;
import com.swab.backend.modules.scheduler.application.MessageDeliveryException;
import com.swab.backend.modules.scheduler.application.NotificationSchedulerEngine;
import com.swab.backend.modules.scheduler.application.NotificationStoreException;
import com.swab.backend.modules.scheduler.config.SchedulerProperties;
import com.swab.backend.modules.scheduler.presentation.dto.ProbeRequest;
import com.swab.backend.modules.scheduler.presentation.dto.ScheduledJobResponse;
import com.swab.backend.modules.scheduler.presentation.dto.SchedulerStatusResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Scheduler", description = "Live weekly timer set")
@RestController
@RequestMapping("/scheduler")
public class SchedulerController {

    private final NotificationSchedulerEngine engine;
    private final SchedulerProperties properties;

    public SchedulerController(NotificationSchedulerEngine engine, SchedulerProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Operation(summary = "Armed jobs", description = "One entry per armed notification with its next fire time.")
    @GetMapping("/jobs")
    public ResponseEntity<List<ScheduledJobResponse>> listJobs() {
        List<ScheduledJobResponse> jobs = engine.jobs().stream()
                .map(job -> new ScheduledJobResponse(
                        job.notificationId(),
                        job.recurrence().describe(),
                        job.recurrence().toCronExpression(),
                        job.nextFireTime() != null ? job.nextFireTime().toOffsetDateTime() : null
                ))
                .toList();
        return ResponseEntity.ok(jobs);
    }

    @Operation(summary = "Rebuild the timer set from the store")
    @PostMapping("/refresh")
    public ResponseEntity<SchedulerStatusResponse> refresh() {
        try {
            engine.rearmAll();
        } catch (NotificationStoreException ex) {
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "SCHEDULER_REFRESH_FAILED", ex.getMessage(), ex);
        }
        return ResponseEntity.ok(new SchedulerStatusResponse(engine.state().name(), engine.count()));
    }

    @Operation(summary = "Send a probe message", description = "Unscheduled and unlogged; verifies webhook connectivity.")
    @PostMapping("/probe")
    public ResponseEntity<Void> probe(@Valid @RequestBody(required = false) ProbeRequest request) {
        String text = request != null && request.text() != null && !request.text().isBlank()
                ? request.text()
                : properties.probeText();
        try {
            engine.sendProbe(text);
        } catch (MessageDeliveryException ex) {
            throw new ProblemException(HttpStatus.BAD_GATEWAY, "PROBE_FAILED", ex.getMessage());
        }
        return ResponseEntity.noContent().build();
    }
}
