package com.classroomai.exception;

/**
 * Thrown when a session's internal state is found inconsistent, for example a slide index
 * outside {@code 1..total_slides}. The owning session is forced into its terminal phase.
 */
public class SessionInvariantException extends RuntimeException {

    private final long lessonId;

    public SessionInvariantException(long lessonId, String message) {
        super("Lesson " + lessonId + ": " + message);
        this.lessonId = lessonId;
    }

    public long getLessonId() {
        return lessonId;
    }
}
