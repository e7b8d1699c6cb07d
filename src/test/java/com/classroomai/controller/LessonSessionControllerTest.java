package com.classroomai.controller;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import com.classroomai.dto.ErrorResponse.ErrorCode;

class LessonSessionControllerTest {

    @Test
    @DisplayName("Should map lifecycle errors on commands to HTTP statuses")
    void testCommandStatuses() {
        assertEquals(HttpStatus.NOT_FOUND, LessonSessionController.statusFor(ErrorCode.LESSON_001));
        assertEquals(HttpStatus.BAD_REQUEST, LessonSessionController.statusFor(ErrorCode.LESSON_002));
        assertEquals(HttpStatus.BAD_REQUEST, LessonSessionController.statusFor(ErrorCode.VAL_003));
        assertEquals(HttpStatus.CONFLICT, LessonSessionController.statusFor(ErrorCode.LESSON_003));
        assertEquals(HttpStatus.CONFLICT, LessonSessionController.statusFor(ErrorCode.LESSON_004));
        assertEquals(HttpStatus.CONFLICT, LessonSessionController.statusFor(ErrorCode.LESSON_005));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, LessonSessionController.statusFor(ErrorCode.SRV_001));
    }

    @Test
    @DisplayName("Should report a missing session as not found on reads")
    void testLookupStatuses() {
        assertEquals(HttpStatus.NOT_FOUND, LessonSessionController.lookupStatusFor(ErrorCode.LESSON_004));
        assertEquals(HttpStatus.BAD_REQUEST, LessonSessionController.lookupStatusFor(ErrorCode.LESSON_002));
    }
}
