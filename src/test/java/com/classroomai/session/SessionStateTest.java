package com.classroomai.session;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.classroomai.exception.SessionInvariantException;
import com.classroomai.model.SessionPhase;

class SessionStateTest {

    @Test
    @DisplayName("Should reject a slide position outside the deck")
    void testSlideInvariant() {
        SessionState state = new SessionState(5L);
        state.startPresentation(3, Instant.now());
        state.checkSlideInvariant();

        state.currentSlide(4);

        SessionInvariantException e = assertThrows(SessionInvariantException.class, state::checkSlideInvariant);
        assertEquals(5L, e.getLessonId());
    }

    @Test
    @DisplayName("Should set one-shot timestamps only once")
    void testTimestampsSetOnce() {
        SessionState state = new SessionState(5L);
        Instant first = Instant.parse("2024-05-01T09:00:00Z");
        Instant later = first.plusSeconds(60);

        state.startAttendance(first);
        assertTrue(state.endAttendance(first));
        assertFalse(state.endAttendance(later));
        state.complete(first);
        state.complete(later);

        assertEquals(first, state.attendanceEndedAt());
        assertEquals(first, state.snapshot(0).completedAt());
        assertEquals(SessionPhase.COMPLETED, state.phase());
    }

    @Test
    @DisplayName("Should report current_slide only while a slide is on screen")
    void testSnapshotSlideVisibility() {
        SessionState state = new SessionState(5L);
        assertNull(state.snapshot(0).currentSlide());

        state.startPresentation(2, Instant.now());
        state.pause(Instant.now());
        assertEquals(1, state.snapshot(0).currentSlide());

        state.phase(SessionPhase.QA_ACTIVE);
        assertNull(state.snapshot(0).currentSlide());
    }

    @Test
    @DisplayName("Should remember each student once")
    void testRecordStudent() {
        SessionState state = new SessionState(5L);
        assertTrue(state.recordStudent(11L));
        assertFalse(state.recordStudent(11L));
        assertTrue(state.recordStudent(12L));
    }
}
