package com.swab.backend.modules.notification.presentation;

import java.net.URI;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;

import com.swab.backend.modules.notification.application.ScheduledNotificationService;
import com.swab.backend.modules.notification.domain.NotificationLog;
import com.swab.backend.modules.notification.domain.ScheduledNotification;
import com.swab.backend.modules.notification.presentation.dto.CreateNotificationRequest;
import com.swab.backend.modules.notification.presentation.dto.NotificationLogResponse;
import com.swab.backend.modules.notification.presentation.dto.NotificationResponse;
import com.swab.backend.modules.notification.presentation.dto.NotificationTimeFormat;
import com.swab.backend.modules.notification.presentation.dto.UpdateNotificationRequest;
import com.swab.backend.modules.scheduler.domain.WeeklyRecurrence;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Notifications", description = "Weekly Slack notification definitions")
@RestController
@RequestMapping("/notifications")
public class ScheduledNotificationController {

    private final ScheduledNotificationService notificationService;

    public ScheduledNotificationController(ScheduledNotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Operation(summary = "List notifications", description = "Ordered by id; optionally filtered by active flag and day.")
    @GetMapping
    public ResponseEntity<List<NotificationResponse>> list(
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "dayOfWeek", required = false) Integer dayOfWeek
    ) {
        List<NotificationResponse> body = notificationService.list(active, dayOfWeek).stream()
                .map(this::toResponse)
                .toList();
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<NotificationResponse> get(@PathVariable("id") long id) {
        return ResponseEntity.ok(toResponse(notificationService.get(id)));
    }

    @Operation(summary = "Create a notification", description = "The schedule is refreshed after the row commits.")
    @PostMapping
    public ResponseEntity<NotificationResponse> create(@Valid @RequestBody CreateNotificationRequest request) {
        ScheduledNotification created = notificationService.create(
                request.message(),
                request.dayOfWeek(),
                request.time(),
                request.active()
        );
        return ResponseEntity.created(URI.create("/notifications/" + created.getId()))
                .body(toResponse(created));
    }

    @Operation(summary = "Update a notification", description = "Fields left out of the body are unchanged.")
    @PutMapping("/{id}")
    public ResponseEntity<NotificationResponse> update(
            @PathVariable("id") long id,
            @Valid @RequestBody UpdateNotificationRequest request
    ) {
        ScheduledNotification updated = notificationService.update(
                id,
                request.message(),
                request.dayOfWeek(),
                request.time(),
                request.active()
        );
        return ResponseEntity.ok(toResponse(updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        notificationService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Flip the active flag")
    @PostMapping("/{id}/toggle")
    public ResponseEntity<NotificationResponse> toggle(@PathVariable("id") long id) {
        return ResponseEntity.ok(toResponse(notificationService.toggle(id)));
    }

    @Operation(summary = "Delivery history", description = "Newest first; kept after the notification is deleted.")
    @GetMapping("/{id}/logs")
    public ResponseEntity<List<NotificationLogResponse>> logs(
            @PathVariable("id") long id,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        List<NotificationLogResponse> body = notificationService.listLogs(id, limit).stream()
                .map(this::toLogResponse)
                .toList();
        return ResponseEntity.ok(body);
    }

    private NotificationResponse toResponse(ScheduledNotification notification) {
        WeeklyRecurrence recurrence = WeeklyRecurrence.of(notification.getDayOfWeek(), notification.getSendTime());
        return new NotificationResponse(
                notification.getId(),
                notification.getMessage(),
                notification.getDayOfWeek(),
                recurrence.day().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                notification.getSendTime().format(NotificationTimeFormat.FORMATTER),
                notification.isActive(),
                notification.getCreatedAt(),
                notification.getUpdatedAt()
        );
    }

    private NotificationLogResponse toLogResponse(NotificationLog entry) {
        return new NotificationLogResponse(
                entry.getId(),
                entry.getNotificationId(),
                entry.getStatus().name(),
                entry.getErrorMessage(),
                entry.getLoggedAt()
        );
    }
}
