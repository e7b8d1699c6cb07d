package com.classroomai.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.classroomai.model.QaRecord;

import reactor.core.publisher.Flux;

/**
 * Reactive repository for question and answer history.
 */
@Repository
public interface QaRecordRepository extends ReactiveCrudRepository<QaRecord, Long> {

    Flux<QaRecord> findByLessonIdOrderByAskedAtAsc(Long lessonId);
}
