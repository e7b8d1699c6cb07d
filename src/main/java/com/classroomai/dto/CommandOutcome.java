package com.classroomai.dto;

import com.classroomai.dto.ErrorResponse.ErrorCode;

/**
 * Result of submitting a command to a session.
 * A rejected command left the session state untouched.
 */
public record CommandOutcome(Status status, ErrorCode errorCode, String message) {

    public enum Status {
        APPLIED,
        UNCHANGED,
        REJECTED
    }

    public static CommandOutcome applied() {
        return new CommandOutcome(Status.APPLIED, null, null);
    }

    public static CommandOutcome unchanged() {
        return new CommandOutcome(Status.UNCHANGED, null, null);
    }

    public static CommandOutcome rejected(ErrorCode errorCode, String message) {
        return new CommandOutcome(Status.REJECTED, errorCode, message);
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }
}
