package com.classroomai.controller;

import com.classroomai.dto.ErrorResponse;
import com.classroomai.dto.ErrorResponse.ErrorCode;
import com.classroomai.exception.LessonException;
import com.classroomai.service.LessonSessionService;
import com.classroomai.validation.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for manual lesson control and session inspection.
 * All endpoints require TEACHER or ADMIN role.
 */
@RestController
@RequestMapping("/api/lessons")
public class LessonSessionController {

    private static final Logger log = LoggerFactory.getLogger(LessonSessionController.class);

    private final LessonSessionService sessionService;
    private final InputValidator inputValidator;

    public LessonSessionController(LessonSessionService sessionService, InputValidator inputValidator) {
        this.sessionService = sessionService;
        this.inputValidator = inputValidator;
    }

    /**
     * Start a lesson session now. Idempotent while the session is active.
     */
    @PostMapping("/{lessonId}/start")
    public Mono<ResponseEntity<Object>> startLesson(@PathVariable String lessonId) {
        return Mono.fromCallable(() -> inputValidator.parseLessonId(lessonId))
                .flatMap(id -> {
                    log.info("Manual start requested for lesson {}", id);
                    return sessionService.startLesson(id);
                })
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .onErrorResume(LessonException.class, this::toErrorResponse);
    }

    /**
     * End the lesson's active session.
     */
    @PostMapping("/{lessonId}/end")
    public Mono<ResponseEntity<Object>> endLesson(@PathVariable String lessonId) {
        return Mono.fromCallable(() -> inputValidator.parseLessonId(lessonId))
                .flatMap(id -> {
                    log.info("Manual end requested for lesson {}", id);
                    return sessionService.endLesson(id);
                })
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .onErrorResume(LessonException.class, this::toErrorResponse);
    }

    /**
     * Current session snapshot.
     */
    @GetMapping("/{lessonId}/session")
    public Mono<ResponseEntity<Object>> getSession(@PathVariable String lessonId) {
        return Mono.fromCallable(() -> inputValidator.parseLessonId(lessonId))
                .flatMap(sessionService::snapshot)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .onErrorResume(LessonException.class, this::toLookupErrorResponse);
    }

    /**
     * Number of live connections on the lesson.
     */
    @GetMapping("/{lessonId}/connections")
    public Mono<ResponseEntity<Object>> getConnections(@PathVariable String lessonId) {
        return Mono.fromCallable(() -> inputValidator.parseLessonId(lessonId))
                .flatMap(id -> sessionService.connectionCount(id).map(count -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("lesson_id", id);
                    body.put("active_connections", count);
                    return body;
                }))
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .onErrorResume(LessonException.class, this::toLookupErrorResponse);
    }

    /**
     * Lessons with an active session.
     */
    @GetMapping("/active")
    public Mono<Map<String, Object>> getActiveLessons() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active_lessons", sessionService.activeLessons());
        return Mono.just(body);
    }

    private Mono<ResponseEntity<Object>> toErrorResponse(LessonException e) {
        return toErrorResponse(e, statusFor(e.getErrorCode()));
    }

    private Mono<ResponseEntity<Object>> toLookupErrorResponse(LessonException e) {
        return toErrorResponse(e, lookupStatusFor(e.getErrorCode()));
    }

    private Mono<ResponseEntity<Object>> toErrorResponse(LessonException e, HttpStatus status) {
        log.warn("Lesson request failed: {}", e.getMessage());
        return Mono.just(ResponseEntity.status(status)
                .body(ErrorResponse.of(e.getErrorCode(), e.getDetails())));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case LESSON_001 -> HttpStatus.NOT_FOUND;
            case LESSON_002, VAL_002, VAL_003, VAL_004 -> HttpStatus.BAD_REQUEST;
            case SRV_001 -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.CONFLICT;
        };
    }

    /**
     * Reads of a session that does not exist are a missing resource, not a conflict.
     */
    static HttpStatus lookupStatusFor(ErrorCode code) {
        return code == ErrorCode.LESSON_004 ? HttpStatus.NOT_FOUND : statusFor(code);
    }
}
