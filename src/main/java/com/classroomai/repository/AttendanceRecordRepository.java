package com.classroomai.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.classroomai.model.AttendanceRecord;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive repository for attendance records.
 */
@Repository
public interface AttendanceRecordRepository extends ReactiveCrudRepository<AttendanceRecord, Long> {

    Flux<AttendanceRecord> findByLessonId(Long lessonId);

    Mono<Boolean> existsByLessonIdAndStudentId(Long lessonId, Long studentId);
}
