package com.classroomai.validation;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.classroomai.config.ClassroomProperties;
import com.classroomai.dto.ErrorResponse.ErrorCode;
import com.classroomai.exception.LessonException;

class InputValidatorTest {

    private InputValidator validator;

    @BeforeEach
    void setUp() {
        ClassroomProperties properties = new ClassroomProperties();
        properties.getSession().setMaxQuestionLength(20);
        validator = new InputValidator(properties);
    }

    @Test
    @DisplayName("Should parse positive lesson IDs")
    void testParseLessonId() {
        assertEquals(1L, validator.parseLessonId("1"));
        assertEquals(123456789012345678L, validator.parseLessonId("123456789012345678"));
    }

    @Test
    @DisplayName("Should reject empty, signed, zero-padded and oversized lesson IDs")
    void testParseLessonIdInvalid() {
        assertEquals(ErrorCode.VAL_002,
                assertThrows(LessonException.class, () -> validator.parseLessonId("")).getErrorCode());
        assertEquals(ErrorCode.VAL_002,
                assertThrows(LessonException.class, () -> validator.parseLessonId(null)).getErrorCode());
        for (String raw : new String[] {"0", "-4", "007", "12a", "1234567890123456789", "../etc"}) {
            LessonException e = assertThrows(LessonException.class, () -> validator.parseLessonId(raw), raw);
            assertEquals(ErrorCode.LESSON_002, e.getErrorCode(), raw);
        }
    }

    @Test
    @DisplayName("Should sanitize questions and enforce the length limit")
    void testValidateQuestion() {
        assertEquals("Why is the sky blue?", validator.validateQuestion("  Why is the sky\u0000 blue?\u001b "));
        assertEquals("line one\nline two", validator.validateQuestion("line one\nline two"));

        assertEquals(ErrorCode.VAL_002,
                assertThrows(LessonException.class, () -> validator.validateQuestion(" \u0007 ")).getErrorCode());
        assertEquals(ErrorCode.VAL_003,
                assertThrows(LessonException.class,
                        () -> validator.validateQuestion("This question is longer than twenty")).getErrorCode());
    }

    @Test
    @DisplayName("Should pass null through sanitize")
    void testSanitizeNull() {
        assertNull(validator.sanitize(null));
    }
}
