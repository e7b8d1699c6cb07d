package com.classroomai.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.classroomai.collaborator.LessonStore;
import com.classroomai.dto.CommandOutcome;
import com.classroomai.dto.CommandType;
import com.classroomai.dto.ErrorResponse.ErrorCode;
import com.classroomai.dto.LessonCommand;
import com.classroomai.exception.LessonException;
import com.classroomai.model.SessionSnapshot;
import com.classroomai.session.SessionActor;
import com.classroomai.session.SessionRegistry;

import reactor.core.publisher.Mono;

/**
 * Lesson lifecycle shared by the scheduler and the REST API: start, end and inspect sessions.
 */
@Service
public class LessonSessionService {

    private static final Logger logger = LoggerFactory.getLogger(LessonSessionService.class);

    private final SessionRegistry registry;
    private final LessonStore lessonStore;
    private final CommandDispatcher dispatcher;
    private final Clock clock;

    public LessonSessionService(SessionRegistry registry, LessonStore lessonStore,
                                CommandDispatcher dispatcher, Clock clock) {
        this.registry = registry;
        this.lessonStore = lessonStore;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * Start a session for the lesson, or return the running one.
     * The lesson record is marked started only by the call that created the session.
     */
    public Mono<SessionSnapshot> startLesson(long lessonId) {
        return lessonStore.findStatus(lessonId)
                .switchIfEmpty(Mono.error(new LessonException(ErrorCode.LESSON_001, "lesson " + lessonId)))
                .flatMap(status -> {
                    if (!status.isStartable()) {
                        return Mono.error(new LessonException(ErrorCode.LESSON_003,
                                "lesson " + lessonId + " is " + status));
                    }
                    SessionRegistry.StartResult result = registry.getOrCreate(lessonId);
                    SessionActor actor = result.actor();
                    if (!result.created()) {
                        return Mono.fromSupplier(actor::snapshot);
                    }
                    logger.info("Lesson {} started (was {})", lessonId, status);
                    return lessonStore.markStarted(lessonId, LocalDateTime.now(clock))
                            .onErrorResume(e -> {
                                logger.warn("Could not mark lesson {} started: {}", lessonId, e.getMessage());
                                return Mono.empty();
                            })
                            .then(Mono.fromSupplier(actor::snapshot));
                });
    }

    /**
     * End the lesson's session the same way an {@code end_lesson} command would.
     */
    public Mono<SessionSnapshot> endLesson(long lessonId) {
        return Mono.fromCallable(() -> {
            CommandOutcome outcome = dispatcher.dispatchSystem(lessonId, LessonCommand.of(CommandType.END_LESSON));
            if (outcome.isRejected()) {
                throw new LessonException(outcome.errorCode(), outcome.message());
            }
            return registry.find(lessonId)
                    .map(SessionActor::snapshot)
                    .orElseThrow(() -> new LessonException(ErrorCode.LESSON_004, "lesson " + lessonId));
        });
    }

    public Mono<SessionSnapshot> snapshot(long lessonId) {
        return Mono.fromCallable(() -> activeSession(lessonId).snapshot());
    }

    public Mono<Integer> connectionCount(long lessonId) {
        return Mono.fromCallable(() -> activeSession(lessonId).hub().connectionCount());
    }

    public List<Long> activeLessons() {
        return registry.activeLessonIds();
    }

    private SessionActor activeSession(long lessonId) {
        return registry.find(lessonId)
                .orElseThrow(() -> new LessonException(ErrorCode.LESSON_004, "lesson " + lessonId));
    }
}
