package com.classroomai.collaborator;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One recognized student from an attendance scan.
 */
public record AttendanceMatch(
        @JsonProperty("student_id") long studentId,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("photo") String photo) {
}
