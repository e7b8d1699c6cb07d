package com.classroomai.exception;

import com.classroomai.dto.ErrorResponse.ErrorCode;

/**
 * Exception for lesson lifecycle and command protocol errors.
 */
public class LessonException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String details;

    public LessonException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.details = null;
    }

    public LessonException(ErrorCode errorCode, String details) {
        super(errorCode.getMessage() + ": " + details);
        this.errorCode = errorCode;
        this.details = details;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDetails() {
        return details;
    }

    public String getCode() {
        return errorCode.getCode();
    }
}
