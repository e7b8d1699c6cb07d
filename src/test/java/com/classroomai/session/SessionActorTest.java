package com.classroomai.session;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.classroomai.collaborator.AnswerResult;
import com.classroomai.dto.CommandOutcome;
import com.classroomai.dto.CommandType;
import com.classroomai.dto.ErrorResponse.ErrorCode;
import com.classroomai.dto.LessonCommand;
import com.classroomai.model.ConnectionRole;
import com.classroomai.model.QuestionMethod;
import com.classroomai.model.SessionPhase;
import com.classroomai.model.SessionSnapshot;
import com.classroomai.session.SessionTestSupport.Fakes;
import com.classroomai.session.SessionTestSupport.TestClient;
import com.fasterxml.jackson.databind.JsonNode;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Tests for the lesson state machine and its events.
 */
class SessionActorTest {

    private static final long LESSON_ID = 42L;

    private Fakes fakes;
    private List<Long> completions;
    private SessionActor actor;
    private TestClient teacher;
    private TestClient student;

    @BeforeEach
    void setUp() {
        fakes = new Fakes();
        completions = new CopyOnWriteArrayList<>();
        actor = SessionTestSupport.newActor(LESSON_ID, fakes, Duration.ofSeconds(5), completions::add);
        teacher = new TestClient(actor, ConnectionRole.TEACHER);
        student = new TestClient(actor, ConnectionRole.STUDENT);
    }

    private CommandOutcome submit(CommandType type, TestClient from) {
        return actor.submit(LessonCommand.of(type), from.connection());
    }

    private CommandOutcome ask(String question, TestClient from) {
        return actor.submit(LessonCommand.askQuestion(question, QuestionMethod.TEXT), from.connection());
    }

    private void startPresentation() {
        assertEquals(CommandOutcome.Status.APPLIED, submit(CommandType.START_PRESENTATION, teacher).status());
        assertEquals(SessionPhase.PRESENTATION_ACTIVE, actor.snapshot().phase());
    }

    @Test
    @DisplayName("Should send a lesson_state snapshot to a connection as soon as it joins")
    void testJoinSendsSnapshot() {
        JsonNode first = teacher.events().get(0);
        assertEquals("lesson_state", first.get("type").asText());
        assertEquals("scheduled", first.get("data").get("phase").asText());
        assertEquals(LESSON_ID, first.get("data").get("lesson_id").asLong());
        assertTrue(first.get("data").get("current_slide").isNull());

        assertEquals(2, actor.snapshot().connectionCount());
    }

    @Test
    @DisplayName("Should stream attendance matches once each until attendance ends")
    void testAttendanceFlow() {
        assertEquals(CommandOutcome.Status.APPLIED, submit(CommandType.START_ATTENDANCE, teacher).status());
        assertEquals(SessionPhase.ATTENDANCE_ACTIVE, actor.snapshot().phase());
        assertEquals(1, student.ofType("attendance_started").size());

        fakes.attendance.emit(7L, 0.93);
        fakes.attendance.emit(7L, 0.95);
        fakes.attendance.emit(8L, 0.81);

        List<JsonNode> updates = student.ofType("attendance_update");
        assertEquals(2, updates.size());
        assertEquals(7L, updates.get(0).get("student_id").asLong());
        assertEquals(0.93, updates.get(0).get("confidence").asDouble(), 0.0001);
        assertEquals("photos/7.jpg", updates.get(0).get("photo").asText());
        assertEquals(List.of(7L, 8L), fakes.lessons.attendance);

        assertEquals(CommandOutcome.Status.APPLIED, submit(CommandType.END_ATTENDANCE, teacher).status());
        assertEquals(1, student.ofType("attendance_ended").size());
        assertEquals(SessionPhase.ATTENDANCE_ACTIVE, actor.snapshot().phase());
        assertNotNull(actor.snapshot().attendanceEndedAt());

        fakes.attendance.emit(9L, 0.90);
        assertEquals(2, student.ofType("attendance_update").size());
    }

    @Test
    @DisplayName("Should keep the first attendance end time when end_attendance is repeated")
    void testEndAttendanceTwice() {
        submit(CommandType.START_ATTENDANCE, teacher);
        submit(CommandType.END_ATTENDANCE, teacher);
        Instant endedAt = actor.snapshot().attendanceEndedAt();

        CommandOutcome outcome = submit(CommandType.END_ATTENDANCE, teacher);

        assertEquals(CommandOutcome.Status.UNCHANGED, outcome.status());
        assertEquals(endedAt, actor.snapshot().attendanceEndedAt());
        assertEquals(1, student.ofType("attendance_ended").size());
        assertEquals(2, teacher.ofType("attendance_ended").size());
    }

    @Test
    @DisplayName("Should reject an out-of-phase command to the issuer only and leave state untouched")
    void testOutOfPhaseRejected() {
        SessionSnapshot before = actor.snapshot();
        student.clear();

        CommandOutcome outcome = submit(CommandType.NEXT_SLIDE, teacher);

        assertTrue(outcome.isRejected());
        assertEquals(ErrorCode.CMD_003, outcome.errorCode());
        JsonNode error = teacher.last();
        assertEquals("error", error.get("type").asText());
        assertEquals("CMD_003", error.get("code").asText());
        assertTrue(student.events().isEmpty());
        assertEquals(before, actor.snapshot());
    }

    @Test
    @DisplayName("Should not allow Q&A to be entered straight from attendance")
    void testNoAttendanceToQa() {
        submit(CommandType.START_ATTENDANCE, teacher);

        CommandOutcome outcome = submit(CommandType.START_QA, teacher);

        assertTrue(outcome.isRejected());
        assertEquals(SessionPhase.ATTENDANCE_ACTIVE, actor.snapshot().phase());
    }

    @Test
    @DisplayName("Should start the presentation on slide 1 and end attendance implicitly")
    void testStartPresentationFromAttendance() {
        submit(CommandType.START_ATTENDANCE, teacher);
        startPresentation();

        SessionSnapshot snapshot = actor.snapshot();
        assertEquals(1, snapshot.currentSlide());
        assertEquals(3, snapshot.totalSlides());
        assertNotNull(snapshot.attendanceEndedAt());
        assertNotNull(snapshot.presentationStartedAt());

        JsonNode started = student.ofType("presentation_started").get(0);
        assertEquals(3, started.get("total_slides").asInt());
        assertEquals(1, started.get("slide").get("slide_number").asInt());
        assertEquals("Slide 1", started.get("slide").get("text").asText());
    }

    @Test
    @DisplayName("Should go 1 -> 2 -> 3 -> completed over three next_slide commands on a 3 slide deck")
    void testThreeSlideScenario() {
        startPresentation();

        submit(CommandType.NEXT_SLIDE, teacher);
        assertEquals(2, actor.snapshot().currentSlide());
        submit(CommandType.NEXT_SLIDE, teacher);
        assertEquals(3, actor.snapshot().currentSlide());
        submit(CommandType.NEXT_SLIDE, teacher);

        assertEquals(SessionPhase.QA_ACTIVE, actor.snapshot().phase());
        assertNull(actor.snapshot().currentSlide());

        List<JsonNode> changes = student.ofType("slide_changed");
        assertEquals(2, changes.size());
        assertEquals(2, changes.get(0).get("slide_number").asInt());
        assertEquals(3, changes.get(1).get("slide_number").asInt());
        assertEquals("audio/slide_3.mp3", changes.get(1).get("audio_ref").asText());
        assertEquals(1, student.ofType("presentation_completed").size());

        CommandOutcome fourth = submit(CommandType.NEXT_SLIDE, teacher);
        assertEquals(ErrorCode.CMD_003, fourth.errorCode());
        assertEquals(1, student.ofType("presentation_completed").size());
    }

    @Test
    @DisplayName("Should floor previous_slide at 1 and resend slide 1 to the issuer")
    void testPreviousSlideFloor() {
        startPresentation();
        submit(CommandType.NEXT_SLIDE, teacher);
        submit(CommandType.PREVIOUS_SLIDE, teacher);
        assertEquals(1, actor.snapshot().currentSlide());
        student.clear();

        CommandOutcome outcome = submit(CommandType.PREVIOUS_SLIDE, teacher);

        assertEquals(CommandOutcome.Status.UNCHANGED, outcome.status());
        assertEquals(1, actor.snapshot().currentSlide());
        assertEquals(1, teacher.last().get("slide_number").asInt());
        assertTrue(student.events().isEmpty());
    }

    @Test
    @DisplayName("Should pause on slide 2, accept a question, and resume on slide 2")
    void testPauseQuestionResumeScenario() {
        startPresentation();
        submit(CommandType.NEXT_SLIDE, teacher);

        submit(CommandType.PAUSE_PRESENTATION, teacher);
        assertEquals(SessionPhase.PAUSED, actor.snapshot().phase());
        assertEquals(2, student.ofType("presentation_paused").get(0).get("current_slide").asInt());

        CommandOutcome asked = ask("what is X", student);
        assertFalse(asked.isRejected());
        assertEquals("what is X", student.ofType("question_received").get(0).get("question").asText());

        submit(CommandType.RESUME_PRESENTATION, teacher);
        SessionSnapshot snapshot = actor.snapshot();
        assertEquals(SessionPhase.PRESENTATION_ACTIVE, snapshot.phase());
        assertEquals(2, snapshot.currentSlide());
        assertNull(snapshot.pausedAt());
    }

    @Test
    @DisplayName("Should treat a second pause as a no-op answered to the issuer only")
    void testPauseIdempotent() {
        startPresentation();
        submit(CommandType.PAUSE_PRESENTATION, teacher);
        Instant pausedAt = actor.snapshot().pausedAt();
        assertNotNull(pausedAt);

        CommandOutcome second = submit(CommandType.PAUSE_PRESENTATION, teacher);

        assertEquals(CommandOutcome.Status.UNCHANGED, second.status());
        assertEquals(SessionPhase.PAUSED, actor.snapshot().phase());
        assertEquals(pausedAt, actor.snapshot().pausedAt());
        assertEquals(1, student.ofType("presentation_paused").size());
        assertEquals(2, teacher.ofType("presentation_paused").size());
    }

    @Test
    @DisplayName("Should treat resume while presenting as a no-op")
    void testResumeIdempotent() {
        startPresentation();

        CommandOutcome outcome = submit(CommandType.RESUME_PRESENTATION, teacher);

        assertEquals(CommandOutcome.Status.UNCHANGED, outcome.status());
        assertEquals(SessionPhase.PRESENTATION_ACTIVE, actor.snapshot().phase());
        assertTrue(student.ofType("presentation_resumed").isEmpty());
    }

    @Test
    @DisplayName("Should give a late joiner the same current slide earlier connections saw")
    void testLateJoinSnapshot() {
        startPresentation();

        TestClient late = new TestClient(actor, ConnectionRole.VIEWER);

        JsonNode state = late.events().get(0);
        assertEquals("lesson_state", state.get("type").asText());
        assertEquals("presentation_active", state.get("data").get("phase").asText());
        assertEquals(1, state.get("data").get("current_slide").asInt());
        assertEquals(3, state.get("data").get("total_slides").asInt());
        assertEquals(3, state.get("data").get("connection_count").asInt());
    }

    @Test
    @DisplayName("Should allow one pending question at a time and clear it when answered")
    void testSingleSlotQuestion() {
        Sinks.One<AnswerResult> answer = Sinks.one();
        fakes.answers.respondWith((question, method) -> answer.asMono());
        startPresentation();

        assertFalse(ask("What is photosynthesis?", student).isRejected());
        assertNotNull(actor.snapshot().pendingQuestion());

        CommandOutcome second = ask("And respiration?", teacher);
        assertEquals(ErrorCode.CMD_004, second.errorCode());
        assertEquals("CMD_004", teacher.last().get("code").asText());

        answer.tryEmitValue(new AnswerResult("Plants turn light into energy", "audio/a1.mp3", true));

        assertNull(actor.snapshot().pendingQuestion());
        JsonNode answered = student.ofType("question_answered").get(0);
        assertEquals("What is photosynthesis?", answered.get("question").asText());
        assertEquals("Plants turn light into energy", answered.get("answer_text").asText());
        assertEquals("audio/a1.mp3", answered.get("audio_ref").asText());
        assertTrue(answered.get("found").asBoolean());
        assertEquals(1, fakes.lessons.answered.size());

        fakes.answers.respondWith((question, method) -> Mono.just(AnswerResult.notFound()));
        assertFalse(ask("And respiration?", teacher).isRejected());
    }

    @Test
    @DisplayName("Should answer found=false when the answer service fails")
    void testAnswerFailureDegrades() {
        fakes.answers.respondWith((question, method) -> Mono.error(new IllegalStateException("LLM down")));
        startPresentation();

        ask("Why?", student);

        JsonNode answered = student.ofType("question_answered").get(0);
        assertFalse(answered.get("found").asBoolean());
        assertEquals(SessionPhase.PRESENTATION_ACTIVE, actor.snapshot().phase());
        assertNull(actor.snapshot().pendingQuestion());
    }

    @Test
    @DisplayName("Should answer found=false when the answer service never responds")
    void testAnswerTimeoutDegrades() {
        SessionActor slowActor = SessionTestSupport.newActor(7L, fakes, Duration.ofMillis(100), id -> { });
        TestClient client = new TestClient(slowActor, ConnectionRole.STUDENT);
        fakes.answers.respondWith((question, method) -> Mono.never());
        slowActor.submit(LessonCommand.of(CommandType.START_PRESENTATION), client.connection());

        slowActor.submit(LessonCommand.askQuestion("Anyone there?", QuestionMethod.TEXT), client.connection());

        SessionTestSupport.awaitTrue(() -> !client.ofType("question_answered").isEmpty(), Duration.ofSeconds(5));
        assertFalse(client.ofType("question_answered").get(0).get("found").asBoolean());
        assertNull(slowActor.snapshot().pendingQuestion());
    }

    @Test
    @DisplayName("Should report a missing presentation and stay in the current phase")
    void testNoPresentation() {
        fakes.presentations.totalSlides(0);

        submit(CommandType.START_PRESENTATION, teacher);

        assertEquals(SessionPhase.SCHEDULED, actor.snapshot().phase());
        assertEquals("LESSON_006", student.last().get("code").asText());
        // loading flag cleared, so a retry is accepted
        fakes.presentations.totalSlides(2);
        startPresentation();
    }

    @Test
    @DisplayName("Should send a placeholder slide when a slide cannot be fetched")
    void testSlideFetchFailure() {
        startPresentation();
        fakes.presentations.failSlides();

        submit(CommandType.NEXT_SLIDE, teacher);

        JsonNode changed = student.last();
        assertEquals("slide_changed", changed.get("type").asText());
        assertEquals(2, changed.get("slide_number").asInt());
        assertTrue(changed.get("text").isNull());
        assertEquals(SessionPhase.PRESENTATION_ACTIVE, actor.snapshot().phase());
    }

    @Test
    @DisplayName("Should discard slide content that arrives after the deck has moved on")
    void testStaleSlideDiscarded() {
        fakes.presentations.totalSlides(5);
        startPresentation();
        fakes.presentations.hold(2);

        submit(CommandType.NEXT_SLIDE, teacher);
        submit(CommandType.NEXT_SLIDE, teacher);
        fakes.presentations.release(2);

        List<JsonNode> changes = student.ofType("slide_changed");
        assertEquals(1, changes.size());
        assertEquals(3, changes.get(0).get("slide_number").asInt());
    }

    @Test
    @DisplayName("Should enter Q&A early with start_qa")
    void testManualQa() {
        startPresentation();
        submit(CommandType.PAUSE_PRESENTATION, teacher);

        submit(CommandType.START_QA, teacher);

        assertEquals(SessionPhase.QA_ACTIVE, actor.snapshot().phase());
        assertEquals(1, student.ofType("qa_mode_started").size());
        assertFalse(ask("One more thing", student).isRejected());
    }

    @Test
    @DisplayName("Should complete the lesson, notify listeners, and reject later commands")
    void testEndLesson() {
        startPresentation();

        submit(CommandType.END_LESSON, teacher);

        SessionSnapshot snapshot = actor.snapshot();
        assertEquals(SessionPhase.COMPLETED, snapshot.phase());
        assertNotNull(snapshot.completedAt());
        assertTrue(actor.isCompleted());
        assertEquals(1, student.ofType("lesson_ended").size());
        assertEquals(List.of(LESSON_ID), completions);
        assertEquals(List.of(LESSON_ID), fakes.lessons.completed);

        CommandOutcome after = submit(CommandType.START_QA, teacher);
        assertEquals(ErrorCode.LESSON_005, after.errorCode());
        assertEquals(SessionPhase.COMPLETED, actor.snapshot().phase());
    }

    @Test
    @DisplayName("Should drop an answer that arrives after the lesson ended")
    void testAnswerAfterEnd() {
        Sinks.One<AnswerResult> answer = Sinks.one();
        fakes.answers.respondWith((question, method) -> answer.asMono());
        startPresentation();
        ask("Late?", student);

        submit(CommandType.END_LESSON, teacher);
        answer.tryEmitValue(new AnswerResult("Too late", null, true));

        assertTrue(student.ofType("question_answered").isEmpty());
        assertTrue(fakes.lessons.answered.isEmpty());
    }

    @Test
    @DisplayName("Should keep serving other connections after one leaves")
    void testLeave() {
        actor.leave(student.connection());

        assertEquals(1, actor.snapshot().connectionCount());
        assertTrue(student.connection().isClosed());

        submit(CommandType.START_ATTENDANCE, teacher);
        assertEquals(1, teacher.ofType("attendance_started").size());
        assertTrue(student.ofType("attendance_started").isEmpty());
    }

    @Test
    @DisplayName("Should refuse to open attendance while the presentation is loading")
    void testAttendanceRejectedWhilePresentationLoads() {
        fakes.presentations.hold(1);

        assertEquals(CommandOutcome.Status.APPLIED, submit(CommandType.START_PRESENTATION, teacher).status());
        CommandOutcome attendance = submit(CommandType.START_ATTENDANCE, teacher);
        fakes.presentations.release(1);

        assertEquals(ErrorCode.CMD_005, attendance.errorCode());
        assertEquals("CMD_005", teacher.ofType("error").get(0).get("code").asText());
        assertEquals(List.of("lesson_state", "presentation_started"), student.types());

        SessionSnapshot snapshot = actor.snapshot();
        assertEquals(SessionPhase.PRESENTATION_ACTIVE, snapshot.phase());
        assertNull(snapshot.attendanceStartedAt());
        assertNull(snapshot.attendanceEndedAt());
    }

    @Test
    @DisplayName("Should forget collaborator calls once they finish")
    void testFinishedCallsReleased() {
        Sinks.One<AnswerResult> answer = Sinks.one();
        fakes.answers.respondWith((question, method) -> answer.asMono());
        fakes.presentations.totalSlides(5);
        startPresentation();
        assertEquals(0, actor.inflightCount());

        fakes.presentations.hold(2);
        submit(CommandType.NEXT_SLIDE, teacher);
        ask("Why?", student);
        assertEquals(2, actor.inflightCount());

        fakes.presentations.release(2);
        assertEquals(1, actor.inflightCount());

        answer.tryEmitValue(new AnswerResult("Because", null, true));
        assertEquals(0, actor.inflightCount());
        assertEquals(1, student.ofType("question_answered").size());
    }

    @Test
    @DisplayName("Should end the lesson with an error when the slide position is corrupt")
    void testCorruptStateForcesCompletion() {
        SessionState state = new SessionState(7L);
        List<Long> ended = new CopyOnWriteArrayList<>();
        SessionActor broken = new SessionActor(state,
                new ConnectionHub(7L, SessionTestSupport.OBJECT_MAPPER, 256), fakes.collaborators(),
                Duration.ofSeconds(5), Duration.ofSeconds(5), Clock.systemUTC(), ended::add);
        TestClient viewer = new TestClient(broken, ConnectionRole.VIEWER);
        broken.submit(LessonCommand.of(CommandType.START_PRESENTATION), null);
        viewer.clear();
        state.currentSlide(9);

        CommandOutcome outcome = broken.submit(LessonCommand.of(CommandType.NEXT_SLIDE), viewer.connection());

        assertEquals(ErrorCode.SRV_001, outcome.errorCode());
        assertEquals(List.of("error", "lesson_ended"), viewer.types());
        assertEquals("SRV_001", viewer.ofType("error").get(0).get("code").asText());
        assertEquals(SessionPhase.COMPLETED, broken.snapshot().phase());
        assertEquals(List.of(7L), ended);
        assertEquals(List.of(7L), fakes.lessons.completed);
    }
}
