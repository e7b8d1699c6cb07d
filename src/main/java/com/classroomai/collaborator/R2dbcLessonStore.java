package com.classroomai.collaborator;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.classroomai.config.ClassroomProperties;
import com.classroomai.model.AttendanceRecord;
import com.classroomai.model.LessonStatus;
import com.classroomai.model.PendingQuestion;
import com.classroomai.model.QaRecord;
import com.classroomai.repository.AttendanceRecordRepository;
import com.classroomai.repository.LessonRepository;
import com.classroomai.repository.QaRecordRepository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Lesson store over the R2DBC repositories.
 */
@Component
public class R2dbcLessonStore implements LessonStore {

    private static final Logger logger = LoggerFactory.getLogger(R2dbcLessonStore.class);

    private final LessonRepository lessonRepository;
    private final AttendanceRecordRepository attendanceRepository;
    private final QaRecordRepository qaRepository;
    private final Duration startWindow;
    private final ZoneId zone;

    public R2dbcLessonStore(LessonRepository lessonRepository,
                            AttendanceRecordRepository attendanceRepository,
                            QaRecordRepository qaRepository,
                            ClassroomProperties properties,
                            Clock clock) {
        this.lessonRepository = lessonRepository;
        this.attendanceRepository = attendanceRepository;
        this.qaRepository = qaRepository;
        this.startWindow = properties.getScheduler().startWindow();
        this.zone = clock.getZone();
    }

    @Override
    public Mono<LessonStatus> findStatus(long lessonId) {
        return lessonRepository.findById(lessonId)
                .map(lesson -> LessonStatus.valueOf(lesson.getStatus()));
    }

    @Override
    public Flux<Long> dueLessons(LocalDateTime now) {
        return lessonRepository.findDueLessonIds(now.minus(startWindow), now);
    }

    @Override
    public Mono<Void> markStarted(long lessonId, LocalDateTime at) {
        return lessonRepository.markStarted(lessonId, at)
                .doOnNext(rows -> {
                    if (rows == 0) {
                        logger.warn("Lesson {} was not marked started (missing or not startable)", lessonId);
                    } else {
                        logger.info("Lesson {} marked IN_PROGRESS", lessonId);
                    }
                })
                .then();
    }

    @Override
    public Mono<Void> markCompleted(long lessonId, LocalDateTime at) {
        return lessonRepository.markCompleted(lessonId, at)
                .doOnNext(rows -> logger.info("Lesson {} marked COMPLETED ({} row(s))", lessonId, rows))
                .then();
    }

    @Override
    public Mono<Void> recordAttendance(long lessonId, AttendanceMatch match, LocalDateTime at) {
        return attendanceRepository.existsByLessonIdAndStudentId(lessonId, match.studentId())
                .flatMap(exists -> {
                    if (exists) {
                        logger.debug("Student {} already recorded for lesson {}", match.studentId(), lessonId);
                        return Mono.<Void>empty();
                    }
                    return attendanceRepository
                            .save(new AttendanceRecord(lessonId, match.studentId(), match.confidence(), at))
                            .then();
                });
    }

    @Override
    public Mono<Void> recordAnswer(long lessonId, PendingQuestion question, AnswerResult answer, long processingTimeMs) {
        QaRecord record = QaRecord.builder()
                .lessonId(lessonId)
                .question(question.question(), question.method())
                .answer(answer.answerText(), answer.audioRef(), answer.found())
                .processingTimeMs(processingTimeMs)
                .askedAt(LocalDateTime.ofInstant(question.askedAt(), zone))
                .build();
        return qaRepository.save(record).then();
    }
}
