package com.classroomai.collaborator;

import reactor.core.publisher.Flux;

/**
 * Face-matching service that recognizes students present for a lesson.
 */
public interface AttendanceScanner {

    /**
     * Scan for students attending the lesson. Matches are emitted as they are recognized.
     */
    Flux<AttendanceMatch> scan(long lessonId);
}
