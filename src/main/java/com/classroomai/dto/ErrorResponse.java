package com.classroomai.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Standardized error response DTO.
 * Provides consistent error format across the REST endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String type;
    private String code;
    private String message;
    private String details;
    private LocalDateTime timestamp;

    // Default constructor
    public ErrorResponse() {
        this.timestamp = LocalDateTime.now();
    }

    // Constructor with code and message
    public ErrorResponse(String code, String message) {
        this();
        this.code = code;
        this.message = message;
        this.type = "error";
    }

    // Static factory methods
    public static ErrorResponse of(ErrorCode errorCode, String details) {
        ErrorResponse response = new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
        response.setDetails(details);
        return response;
    }

    // Error code enum for standardized codes
    public enum ErrorCode {
        // Lesson lifecycle errors (LESSON_XXX)
        LESSON_001("LESSON_001", "Lesson not found"),
        LESSON_002("LESSON_002", "Invalid lesson ID"),
        LESSON_003("LESSON_003", "Lesson cannot be started"),
        LESSON_004("LESSON_004", "No active session for lesson"),
        LESSON_005("LESSON_005", "Lesson has already ended"),
        LESSON_006("LESSON_006", "No presentation available"),

        // Command errors (CMD_XXX)
        CMD_001("CMD_001", "Missing 'type' field"),
        CMD_002("CMD_002", "Unknown message type"),
        CMD_003("CMD_003", "Command not allowed in current phase"),
        CMD_004("CMD_004", "A question is already being answered"),
        CMD_005("CMD_005", "Presentation is already loading"),
        CMD_006("CMD_006", "Malformed message"),

        // Validation errors (VAL_XXX)
        VAL_002("VAL_002", "Missing required field"),
        VAL_003("VAL_003", "Field too long"),
        VAL_004("VAL_004", "Invalid format"),

        // Server errors (SRV_XXX)
        SRV_001("SRV_001", "Internal server error");

        private final String code;
        private final String message;

        ErrorCode(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }
    }

    // Getters and Setters
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }
}
