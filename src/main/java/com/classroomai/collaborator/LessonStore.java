package com.classroomai.collaborator;

import java.time.LocalDateTime;

import com.classroomai.model.LessonStatus;
import com.classroomai.model.PendingQuestion;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable lesson records: status transitions used by the scheduler and the session lifecycle,
 * plus attendance and Q&A history.
 */
public interface LessonStore {

    /**
     * Status of a lesson, empty when the lesson does not exist.
     */
    Mono<LessonStatus> findStatus(long lessonId);

    /**
     * Lessons that have not started and whose scheduled time has passed.
     */
    Flux<Long> dueLessons(LocalDateTime now);

    Mono<Void> markStarted(long lessonId, LocalDateTime at);

    Mono<Void> markCompleted(long lessonId, LocalDateTime at);

    Mono<Void> recordAttendance(long lessonId, AttendanceMatch match, LocalDateTime at);

    Mono<Void> recordAnswer(long lessonId, PendingQuestion question, AnswerResult answer, long processingTimeMs);
}
