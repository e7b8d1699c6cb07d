package com.classroomai.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete stage of a lesson session.
 *
 * <pre>
 * SCHEDULED -> ATTENDANCE_ACTIVE -> PRESENTATION_ACTIVE <-> PAUSED
 *                                          |                  |
 *                                          +--> QA_ACTIVE <---+
 * any non-terminal phase -> COMPLETED
 * </pre>
 *
 * SCHEDULED may also go straight to PRESENTATION_ACTIVE when attendance is skipped.
 */
public enum SessionPhase {

    SCHEDULED("scheduled"),
    ATTENDANCE_ACTIVE("attendance_active"),
    PRESENTATION_ACTIVE("presentation_active"),
    PAUSED("paused"),
    QA_ACTIVE("qa_active"),
    COMPLETED("completed");

    private final String wireName;

    SessionPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /**
     * Phases in which a slide is on screen.
     */
    public boolean isPresenting() {
        return this == PRESENTATION_ACTIVE || this == PAUSED;
    }
}
