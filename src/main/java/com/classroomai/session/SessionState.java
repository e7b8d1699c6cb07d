package com.classroomai.session;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import com.classroomai.exception.SessionInvariantException;
import com.classroomai.model.PendingQuestion;
import com.classroomai.model.SessionPhase;
import com.classroomai.model.SessionSnapshot;

/**
 * Mutable state of one lesson session. Only the owning {@link SessionActor} touches it,
 * and only while holding the actor's lock.
 */
final class SessionState {

    private final long lessonId;
    private SessionPhase phase = SessionPhase.SCHEDULED;
    private int currentSlide;
    private int totalSlides;
    private Instant attendanceStartedAt;
    private Instant attendanceEndedAt;
    private Instant presentationStartedAt;
    private Instant pausedAt;
    private Instant completedAt;
    private PendingQuestion pendingQuestion;
    private boolean presentationLoading;
    private final Set<Long> recordedStudents = new HashSet<>();

    SessionState(long lessonId) {
        this.lessonId = lessonId;
    }

    long lessonId() {
        return lessonId;
    }

    SessionPhase phase() {
        return phase;
    }

    void phase(SessionPhase phase) {
        this.phase = phase;
    }

    int currentSlide() {
        return currentSlide;
    }

    void currentSlide(int currentSlide) {
        this.currentSlide = currentSlide;
    }

    int totalSlides() {
        return totalSlides;
    }

    Instant attendanceEndedAt() {
        return attendanceEndedAt;
    }

    Instant pausedAt() {
        return pausedAt;
    }

    PendingQuestion pendingQuestion() {
        return pendingQuestion;
    }

    void pendingQuestion(PendingQuestion pendingQuestion) {
        this.pendingQuestion = pendingQuestion;
    }

    boolean presentationLoading() {
        return presentationLoading;
    }

    void presentationLoading(boolean presentationLoading) {
        this.presentationLoading = presentationLoading;
    }

    void startAttendance(Instant at) {
        if (attendanceStartedAt == null) {
            attendanceStartedAt = at;
        }
    }

    /**
     * @return false if attendance had already been closed
     */
    boolean endAttendance(Instant at) {
        if (attendanceEndedAt != null) {
            return false;
        }
        attendanceEndedAt = at;
        return true;
    }

    boolean attendanceOpen() {
        return phase == SessionPhase.ATTENDANCE_ACTIVE && attendanceEndedAt == null;
    }

    /**
     * @return true the first time a student is seen in this session
     */
    boolean recordStudent(long studentId) {
        return recordedStudents.add(studentId);
    }

    void startPresentation(int totalSlides, Instant at) {
        if (phase == SessionPhase.ATTENDANCE_ACTIVE) {
            endAttendance(at);
        }
        this.totalSlides = totalSlides;
        this.currentSlide = 1;
        this.phase = SessionPhase.PRESENTATION_ACTIVE;
        if (presentationStartedAt == null) {
            presentationStartedAt = at;
        }
    }

    void pause(Instant at) {
        phase = SessionPhase.PAUSED;
        pausedAt = at;
    }

    void resume() {
        phase = SessionPhase.PRESENTATION_ACTIVE;
        pausedAt = null;
    }

    void complete(Instant at) {
        phase = SessionPhase.COMPLETED;
        pendingQuestion = null;
        presentationLoading = false;
        if (completedAt == null) {
            completedAt = at;
        }
    }

    /**
     * Slide position must be inside the deck while a slide is on screen.
     */
    void checkSlideInvariant() {
        if (totalSlides < 1 || currentSlide < 1 || currentSlide > totalSlides) {
            throw new SessionInvariantException(lessonId,
                    "slide " + currentSlide + " outside 1.." + totalSlides + " in phase " + phase);
        }
    }

    SessionSnapshot snapshot(int connectionCount) {
        return new SessionSnapshot(
                lessonId,
                phase,
                phase.isPresenting() ? currentSlide : null,
                totalSlides,
                attendanceStartedAt,
                attendanceEndedAt,
                presentationStartedAt,
                pausedAt,
                completedAt,
                pendingQuestion,
                connectionCount);
    }
}
