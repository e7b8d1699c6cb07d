package com.classroomai.model;

/**
 * Durable status of a lesson record, as kept by the lesson store.
 */
public enum LessonStatus {
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /**
     * Whether a live session may still be started for a lesson in this status.
     */
    public boolean isStartable() {
        return this == SCHEDULED || this == IN_PROGRESS;
    }
}
