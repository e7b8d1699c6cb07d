package com.classroomai.validation;

import com.classroomai.config.ClassroomProperties;
import com.classroomai.dto.ErrorResponse.ErrorCode;
import com.classroomai.exception.LessonException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Centralized input validation for values arriving from clients.
 */
@Component
public class InputValidator {

    // Lesson ID: positive decimal, at most 18 digits so it fits a long
    private static final Pattern LESSON_ID_PATTERN = Pattern.compile("^[1-9][0-9]{0,17}$");

    // Control characters except tab, newline and carriage return
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\t\\n\\r]]");

    private final int maxQuestionLength;

    public InputValidator(ClassroomProperties properties) {
        this.maxQuestionLength = properties.getSession().getMaxQuestionLength();
    }

    /**
     * Parse a lesson ID taken from a path segment.
     */
    public long parseLessonId(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new LessonException(ErrorCode.VAL_002, "Lesson ID is required");
        }
        if (!LESSON_ID_PATTERN.matcher(raw).matches()) {
            throw new LessonException(ErrorCode.LESSON_002, "Lesson ID must be a positive number");
        }
        return Long.parseLong(raw);
    }

    /**
     * Sanitize a question and check it is present and within bounds.
     * @return the sanitized question
     */
    public String validateQuestion(String question) {
        String sanitized = sanitize(question);
        if (sanitized == null || sanitized.isEmpty()) {
            throw new LessonException(ErrorCode.VAL_002, "Question is required");
        }
        if (sanitized.length() > maxQuestionLength) {
            throw new LessonException(ErrorCode.VAL_003, "Question exceeds maximum length of " + maxQuestionLength);
        }
        return sanitized;
    }

    /**
     * Strip control characters and surrounding whitespace.
     */
    public String sanitize(String input) {
        if (input == null) {
            return null;
        }
        return CONTROL_CHARS.matcher(input).replaceAll("").trim();
    }
}
