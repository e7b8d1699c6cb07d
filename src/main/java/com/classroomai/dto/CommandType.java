package com.classroomai.dto;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import com.classroomai.model.SessionPhase;

/**
 * Client to server command types, keyed by the {@code type} field of the envelope,
 * with the phases in which each command is accepted.
 */
public enum CommandType {

    START_ATTENDANCE("start_attendance", EnumSet.of(SessionPhase.SCHEDULED)),
    END_ATTENDANCE("end_attendance", EnumSet.of(SessionPhase.ATTENDANCE_ACTIVE)),
    START_PRESENTATION("start_presentation", EnumSet.of(SessionPhase.SCHEDULED, SessionPhase.ATTENDANCE_ACTIVE)),
    NEXT_SLIDE("next_slide", EnumSet.of(SessionPhase.PRESENTATION_ACTIVE)),
    PREVIOUS_SLIDE("previous_slide", EnumSet.of(SessionPhase.PRESENTATION_ACTIVE)),
    // PAUSED is accepted as a no-op
    PAUSE_PRESENTATION("pause_presentation", EnumSet.of(SessionPhase.PRESENTATION_ACTIVE, SessionPhase.PAUSED)),
    // PRESENTATION_ACTIVE is accepted as a no-op
    RESUME_PRESENTATION("resume_presentation", EnumSet.of(SessionPhase.PAUSED, SessionPhase.PRESENTATION_ACTIVE)),
    ASK_QUESTION("ask_question", EnumSet.of(SessionPhase.PRESENTATION_ACTIVE, SessionPhase.PAUSED, SessionPhase.QA_ACTIVE)),
    START_QA("start_qa", EnumSet.of(SessionPhase.PRESENTATION_ACTIVE, SessionPhase.PAUSED)),
    END_LESSON("end_lesson", EnumSet.complementOf(EnumSet.of(SessionPhase.COMPLETED)));

    private final String wireName;
    private final Set<SessionPhase> validPhases;

    CommandType(String wireName, Set<SessionPhase> validPhases) {
        this.wireName = wireName;
        this.validPhases = validPhases;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isAllowedIn(SessionPhase phase) {
        return validPhases.contains(phase);
    }

    public static Optional<CommandType> fromWire(String value) {
        for (CommandType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
