package com.classroomai.model;

import java.time.Instant;

/**
 * A live connection admitted to a lesson's hub.
 */
public record ConnectionRecord(String connectionId, long lessonId, ConnectionRole role, Instant joinedAt) {
}
