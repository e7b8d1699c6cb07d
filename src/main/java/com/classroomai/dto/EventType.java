package com.classroomai.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Server to client event types.
 */
public enum EventType {

    LESSON_STATE("lesson_state"),
    ATTENDANCE_STARTED("attendance_started"),
    ATTENDANCE_UPDATE("attendance_update"),
    ATTENDANCE_ENDED("attendance_ended"),
    PRESENTATION_STARTED("presentation_started"),
    SLIDE_CHANGED("slide_changed"),
    PRESENTATION_PAUSED("presentation_paused"),
    PRESENTATION_RESUMED("presentation_resumed"),
    QUESTION_RECEIVED("question_received"),
    QUESTION_ANSWERED("question_answered"),
    PRESENTATION_COMPLETED("presentation_completed"),
    QA_MODE_STARTED("qa_mode_started"),
    LESSON_ENDED("lesson_ended"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
