package com.classroomai.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.classroomai.collaborator.LessonStore;
import com.classroomai.config.ClassroomProperties;

import reactor.core.publisher.Mono;

/**
 * Starts lessons whose scheduled time has come, with no client connected.
 * Goes through {@link LessonSessionService#startLesson(long)} like a manual start.
 */
@Component
public class LessonScheduler {

    private static final Logger logger = LoggerFactory.getLogger(LessonScheduler.class);

    private final LessonStore lessonStore;
    private final LessonSessionService sessionService;
    private final ClassroomProperties properties;
    private final Clock clock;

    public LessonScheduler(LessonStore lessonStore, LessonSessionService sessionService,
                           ClassroomProperties properties, Clock clock) {
        this.lessonStore = lessonStore;
        this.sessionService = sessionService;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "#{@classroomProperties.scheduler.pollInterval}",
               initialDelayString = "#{@classroomProperties.scheduler.initialDelay}")
    public void onSchedule() {
        if (!properties.getScheduler().isEnabled()) {
            return;
        }
        // runs on the scheduling thread; waiting keeps polls from overlapping
        Integer started = pollDueLessons().block();
        if (started != null && started > 0) {
            logger.info("Scheduler started {} lesson(s)", started);
        }
    }

    /**
     * Start every due lesson. A lesson that fails to start does not stop the others.
     * @return number of lessons started or found already running
     */
    public Mono<Integer> pollDueLessons() {
        LocalDateTime now = LocalDateTime.now(clock);
        return lessonStore.dueLessons(now)
                .concatMap(lessonId -> sessionService.startLesson(lessonId)
                        .doOnNext(snapshot -> logger.info("Auto-started lesson {}", lessonId))
                        .thenReturn(1)
                        .onErrorResume(e -> {
                            logger.warn("Auto-start of lesson {} failed: {}", lessonId, e.getMessage());
                            return Mono.just(0);
                        }))
                .reduce(0, Integer::sum)
                .onErrorResume(e -> {
                    logger.error("Scheduler poll failed: {}", e.getMessage(), e);
                    return Mono.just(0);
                });
    }
}
