package com.classroomai.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable copy of a session's state, sent to late joiners and returned by the REST API.
 * {@code currentSlide} is null unless a slide is on screen.
 */
public record SessionSnapshot(
        @JsonProperty("lesson_id") long lessonId,
        @JsonProperty("phase") SessionPhase phase,
        @JsonProperty("current_slide") Integer currentSlide,
        @JsonProperty("total_slides") int totalSlides,
        @JsonProperty("attendance_started_at") Instant attendanceStartedAt,
        @JsonProperty("attendance_ended_at") Instant attendanceEndedAt,
        @JsonProperty("presentation_started_at") Instant presentationStartedAt,
        @JsonProperty("paused_at") Instant pausedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("pending_question") PendingQuestion pendingQuestion,
        @JsonProperty("connection_count") int connectionCount) {
}
