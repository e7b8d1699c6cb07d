package com.classroomai.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a live connection, derived from the token presented at the handshake.
 */
public enum ConnectionRole {

    TEACHER("teacher"),
    STUDENT("student"),
    VIEWER("viewer");

    private final String wireName;

    ConnectionRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Map the {@code role} claim of an access token to a connection role.
     * Admins drive the lesson like teachers; unknown roles only watch.
     */
    public static ConnectionRole fromTokenRole(String role) {
        if (role == null) {
            return VIEWER;
        }
        return switch (role.trim().toUpperCase()) {
            case "TEACHER", "ADMIN" -> TEACHER;
            case "STUDENT" -> STUDENT;
            default -> VIEWER;
        };
    }
}
