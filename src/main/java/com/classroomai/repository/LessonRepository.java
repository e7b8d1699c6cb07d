package com.classroomai.repository;

import java.time.LocalDateTime;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.classroomai.model.Lesson;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive repository for Lesson entity.
 */
@Repository
public interface LessonRepository extends ReactiveCrudRepository<Lesson, Long> {

    /**
     * Scheduled lessons whose start time falls inside [from, to]
     */
    @Query("SELECT id FROM lessons WHERE status = 'SCHEDULED' AND scheduled_at >= :from AND scheduled_at <= :to ORDER BY scheduled_at")
    Flux<Long> findDueLessonIds(LocalDateTime from, LocalDateTime to);

    /**
     * Move a lesson to IN_PROGRESS, keeping the first start time
     */
    @Modifying
    @Query("UPDATE lessons SET status = 'IN_PROGRESS', start_time = COALESCE(start_time, :at), updated_at = CURRENT_TIMESTAMP WHERE id = :lessonId AND status IN ('SCHEDULED', 'IN_PROGRESS')")
    Mono<Integer> markStarted(Long lessonId, LocalDateTime at);

    /**
     * Move a lesson to COMPLETED
     */
    @Modifying
    @Query("UPDATE lessons SET status = 'COMPLETED', end_time = :at, updated_at = CURRENT_TIMESTAMP WHERE id = :lessonId AND status <> 'CANCELLED'")
    Mono<Integer> markCompleted(Long lessonId, LocalDateTime at);
}
