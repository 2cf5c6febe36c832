package com.swab.backend.modules.scheduler.presentation.dto;

public record SchedulerStatusResponse(String state, int scheduledJobs) {
}
