package com.classroomai.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.classroomai.collaborator.AnswerResult;
import com.classroomai.collaborator.AttendanceMatch;
import com.classroomai.collaborator.SlideContent;
import com.classroomai.dto.CommandOutcome;
import com.classroomai.dto.ErrorResponse.ErrorCode;
import com.classroomai.dto.EventType;
import com.classroomai.dto.LessonCommand;
import com.classroomai.dto.LessonEvent;
import com.classroomai.exception.SessionInvariantException;
import com.classroomai.model.ConnectionRecord;
import com.classroomai.model.PendingQuestion;
import com.classroomai.model.SessionPhase;
import com.classroomai.model.SessionSnapshot;

import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Owner of one lesson's state machine.
 *
 * <p>Commands are applied one at a time under the actor's monitor. Collaborator calls are
 * started after the monitor is released; their results re-enter it and are applied only if
 * the state they were started for is still current. Events are queued on connections while
 * the monitor is held, so every connection sees them in the order the state changed.
 */
public class SessionActor {

    private static final Logger logger = LoggerFactory.getLogger(SessionActor.class);

    private final long lessonId;
    private final SessionState state;
    private final ConnectionHub hub;
    private final SessionCollaborators collaborators;
    private final Duration collaboratorTimeout;
    private final Duration answerTimeout;
    private final Clock clock;
    private final LongConsumer completionListener;
    private final Disposable.Composite inflight = Disposables.composite();

    public SessionActor(long lessonId,
                        ConnectionHub hub,
                        SessionCollaborators collaborators,
                        Duration collaboratorTimeout,
                        Duration answerTimeout,
                        Clock clock,
                        LongConsumer completionListener) {
        this(new SessionState(lessonId), hub, collaborators, collaboratorTimeout, answerTimeout, clock,
                completionListener);
    }

    SessionActor(SessionState state,
                 ConnectionHub hub,
                 SessionCollaborators collaborators,
                 Duration collaboratorTimeout,
                 Duration answerTimeout,
                 Clock clock,
                 LongConsumer completionListener) {
        this.lessonId = state.lessonId();
        this.state = state;
        this.hub = hub;
        this.collaborators = collaborators;
        this.collaboratorTimeout = collaboratorTimeout;
        this.answerTimeout = answerTimeout;
        this.clock = clock;
        this.completionListener = completionListener;
    }

    public long lessonId() {
        return lessonId;
    }

    public ConnectionHub hub() {
        return hub;
    }

    /**
     * Apply a command. {@code origin} receives rejections and no-op replies; it is null
     * for commands issued by the server itself.
     */
    public CommandOutcome submit(LessonCommand command, LessonConnection origin) {
        Transition transition;
        synchronized (this) {
            transition = apply(command, origin);
        }
        transition.followUp().run();
        return transition.outcome();
    }

    /**
     * Register a connection and queue the current snapshot on it before any later event.
     */
    public LessonConnection join(ConnectionRecord record) {
        synchronized (this) {
            LessonConnection connection = hub.register(record);
            hub.sendTo(connection, event(EventType.LESSON_STATE).with("data", state.snapshot(hub.connectionCount())));
            return connection;
        }
    }

    public void leave(LessonConnection connection) {
        hub.deregister(connection.id());
    }

    public synchronized SessionSnapshot snapshot() {
        return state.snapshot(hub.connectionCount());
    }

    public synchronized boolean isCompleted() {
        return state.phase().isTerminal();
    }

    /**
     * Cancel outstanding collaborator calls and close every connection.
     */
    public void close() {
        inflight.dispose();
        hub.closeAll();
    }

    private Transition apply(LessonCommand command, LessonConnection origin) {
        SessionPhase phase = state.phase();
        if (phase.isTerminal()) {
            return reject(origin, ErrorCode.LESSON_005, "Lesson " + lessonId + " has already ended");
        }
        if (!command.type().isAllowedIn(phase)) {
            return reject(origin, ErrorCode.CMD_003,
                    "'" + command.type().wireName() + "' is not allowed while lesson is " + phase.wireName());
        }
        logger.debug("Lesson {} applying {} in phase {}", lessonId, command.type().wireName(), phase.wireName());
        try {
            return switch (command.type()) {
                case START_ATTENDANCE -> startAttendance(origin);
                case END_ATTENDANCE -> endAttendance(origin);
                case START_PRESENTATION -> startPresentation(origin);
                case NEXT_SLIDE -> nextSlide();
                case PREVIOUS_SLIDE -> previousSlide(origin);
                case PAUSE_PRESENTATION -> pause(origin);
                case RESUME_PRESENTATION -> resume(origin);
                case ASK_QUESTION -> askQuestion(command, origin);
                case START_QA -> startQa();
                case END_LESSON -> endLesson();
            };
        } catch (SessionInvariantException e) {
            return forceComplete(e);
        }
    }

    private Transition startAttendance(LessonConnection origin) {
        if (state.presentationLoading()) {
            return reject(origin, ErrorCode.CMD_005, "Presentation for lesson " + lessonId + " is already loading");
        }
        Instant now = clock.instant();
        state.phase(SessionPhase.ATTENDANCE_ACTIVE);
        state.startAttendance(now);
        hub.broadcast(event(EventType.ATTENDANCE_STARTED).with("started_at", now));
        return Transition.applied(this::scanAttendance);
    }

    private Transition endAttendance(LessonConnection origin) {
        Instant now = clock.instant();
        if (!state.endAttendance(now)) {
            hub.sendTo(origin, event(EventType.ATTENDANCE_ENDED).with("ended_at", state.attendanceEndedAt()));
            return Transition.unchanged();
        }
        hub.broadcast(event(EventType.ATTENDANCE_ENDED).with("ended_at", now));
        return Transition.applied();
    }

    private Transition startPresentation(LessonConnection origin) {
        if (state.presentationLoading()) {
            return reject(origin, ErrorCode.CMD_005, "Presentation for lesson " + lessonId + " is already loading");
        }
        state.presentationLoading(true);
        return Transition.applied(this::loadPresentation);
    }

    private Transition nextSlide() {
        state.checkSlideInvariant();
        if (state.currentSlide() == state.totalSlides()) {
            state.phase(SessionPhase.QA_ACTIVE);
            logger.info("Lesson {} finished its {} slide(s), entering Q&A", lessonId, state.totalSlides());
            hub.broadcast(event(EventType.PRESENTATION_COMPLETED).with("total_slides", state.totalSlides()));
            return Transition.applied();
        }
        int slide = state.currentSlide() + 1;
        state.currentSlide(slide);
        return Transition.applied(() -> fetchSlide(slide, null));
    }

    private Transition previousSlide(LessonConnection origin) {
        state.checkSlideInvariant();
        if (state.currentSlide() == 1) {
            return Transition.unchanged(() -> fetchSlide(1, origin));
        }
        int slide = state.currentSlide() - 1;
        state.currentSlide(slide);
        return Transition.applied(() -> fetchSlide(slide, null));
    }

    private Transition pause(LessonConnection origin) {
        if (state.phase() == SessionPhase.PAUSED) {
            hub.sendTo(origin, pausedEvent());
            return Transition.unchanged();
        }
        state.checkSlideInvariant();
        state.pause(clock.instant());
        hub.broadcast(pausedEvent());
        return Transition.applied();
    }

    private Transition resume(LessonConnection origin) {
        if (state.phase() == SessionPhase.PRESENTATION_ACTIVE) {
            hub.sendTo(origin, resumedEvent());
            return Transition.unchanged();
        }
        state.checkSlideInvariant();
        state.resume();
        hub.broadcast(resumedEvent());
        return Transition.applied();
    }

    private Transition askQuestion(LessonCommand command, LessonConnection origin) {
        if (state.pendingQuestion() != null) {
            return reject(origin, ErrorCode.CMD_004, "Wait for the current question to be answered");
        }
        String askedBy = origin != null ? origin.record().role().wireName() : "system";
        PendingQuestion question = new PendingQuestion(command.question(), command.method(), askedBy, clock.instant());
        state.pendingQuestion(question);
        hub.broadcast(event(EventType.QUESTION_RECEIVED)
                .with("question", question.question())
                .with("method", question.method()));
        return Transition.applied(() -> requestAnswer(question));
    }

    private Transition startQa() {
        state.phase(SessionPhase.QA_ACTIVE);
        hub.broadcast(event(EventType.QA_MODE_STARTED));
        return Transition.applied();
    }

    private Transition endLesson() {
        Instant now = clock.instant();
        state.complete(now);
        logger.info("Lesson {} completed", lessonId);
        hub.broadcast(event(EventType.LESSON_ENDED).with("completed_at", now));
        return Transition.applied(() -> onCompleted(now));
    }

    private Transition forceComplete(SessionInvariantException e) {
        logger.error("Invariant violated, forcing lesson {} to complete: {}", lessonId, e.getMessage());
        hub.broadcast(LessonEvent.error(ErrorCode.SRV_001, "Lesson session failed and was ended", clock.instant()));
        Instant now = clock.instant();
        state.complete(now);
        hub.broadcast(event(EventType.LESSON_ENDED).with("completed_at", now));
        return new Transition(CommandOutcome.rejected(ErrorCode.SRV_001, e.getMessage()), () -> onCompleted(now));
    }

    private Transition reject(LessonConnection origin, ErrorCode code, String message) {
        logger.debug("Lesson {} rejected command: {}", lessonId, message);
        hub.sendTo(origin, LessonEvent.error(code, message, clock.instant()));
        return new Transition(CommandOutcome.rejected(code, message), Transition.NOTHING);
    }

    // Collaborator calls. Each runs outside the monitor and re-enters it to apply its result.

    private void scanAttendance() {
        track(collaborators.attendanceScanner().scan(lessonId)
                .timeout(collaboratorTimeout)
                .onErrorResume(e -> {
                    logger.warn("Attendance scan for lesson {} ended early: {}", lessonId, e.toString());
                    return Flux.empty();
                }), this::onAttendanceMatch);
    }

    private void onAttendanceMatch(AttendanceMatch match) {
        synchronized (this) {
            if (!state.attendanceOpen()) {
                logger.debug("Lesson {} dropped late attendance match for student {}", lessonId, match.studentId());
                return;
            }
            if (!state.recordStudent(match.studentId())) {
                return;
            }
            hub.broadcast(event(EventType.ATTENDANCE_UPDATE)
                    .with("student_id", match.studentId())
                    .with("confidence", match.confidence())
                    .with("photo", match.photo()));
        }
        collaborators.lessonStore()
                .recordAttendance(lessonId, match, LocalDateTime.now(clock))
                .onErrorResume(e -> {
                    logger.warn("Could not record attendance of student {} for lesson {}: {}",
                            match.studentId(), lessonId, e.getMessage());
                    return Mono.empty();
                })
                .subscribe();
    }

    private void loadPresentation() {
        track(collaborators.presentationStore().slideCount(lessonId)
                .filter(count -> count > 0)
                .flatMap(count -> firstSlide().map(slide -> new LoadedPresentation(count, slide)))
                .timeout(collaboratorTimeout)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(e -> {
                    logger.warn("Could not load presentation for lesson {}: {}", lessonId, e.toString());
                    return Mono.just(Optional.empty());
                })
                .flux(), this::onPresentationLoaded);
    }

    private Mono<SlideContent> firstSlide() {
        return collaborators.presentationStore().slide(lessonId, 1)
                .onErrorResume(e -> {
                    logger.warn("Could not fetch first slide of lesson {}: {}", lessonId, e.toString());
                    return Mono.just(SlideContent.placeholder(1));
                })
                .defaultIfEmpty(SlideContent.placeholder(1));
    }

    private synchronized void onPresentationLoaded(Optional<LoadedPresentation> loaded) {
        if (!state.presentationLoading()) {
            return;
        }
        state.presentationLoading(false);
        if (loaded.isEmpty()) {
            hub.broadcast(LessonEvent.error(ErrorCode.LESSON_006,
                    "No presentation available for lesson " + lessonId, clock.instant()));
            return;
        }
        LoadedPresentation presentation = loaded.get();
        state.startPresentation(presentation.totalSlides(), clock.instant());
        logger.info("Lesson {} presentation started with {} slide(s)", lessonId, presentation.totalSlides());
        hub.broadcast(event(EventType.PRESENTATION_STARTED)
                .with("total_slides", presentation.totalSlides())
                .with("slide", presentation.firstSlide()));
    }

    private void fetchSlide(int slide, LessonConnection replyTo) {
        track(collaborators.presentationStore().slide(lessonId, slide)
                .timeout(collaboratorTimeout)
                .onErrorResume(e -> {
                    logger.warn("Could not fetch slide {} of lesson {}: {}", slide, lessonId, e.toString());
                    return Mono.just(SlideContent.placeholder(slide));
                })
                .defaultIfEmpty(SlideContent.placeholder(slide))
                .flux(), content -> onSlideFetched(content, replyTo));
    }

    private synchronized void onSlideFetched(SlideContent content, LessonConnection replyTo) {
        if (!state.phase().isPresenting() || state.currentSlide() != content.slideNumber()) {
            logger.debug("Lesson {} discarded stale slide {}", lessonId, content.slideNumber());
            return;
        }
        LessonEvent changed = event(EventType.SLIDE_CHANGED)
                .with("slide_number", content.slideNumber())
                .with("text", content.text())
                .with("audio_ref", content.audioRef())
                .with("image_ref", content.imageRef());
        if (replyTo != null) {
            hub.sendTo(replyTo, changed);
        } else {
            hub.broadcast(changed);
        }
    }

    private void requestAnswer(PendingQuestion question) {
        long startedAt = clock.millis();
        track(collaborators.answerService().answer(lessonId, question.question(), question.method())
                .timeout(answerTimeout)
                .onErrorResume(e -> {
                    logger.warn("No answer for lesson {}: {}", lessonId, e.toString());
                    return Mono.just(AnswerResult.notFound());
                })
                .defaultIfEmpty(AnswerResult.notFound())
                .flux(), answer -> onAnswer(question, answer, clock.millis() - startedAt));
    }

    private void onAnswer(PendingQuestion question, AnswerResult answer, long processingTimeMs) {
        synchronized (this) {
            if (state.pendingQuestion() != question) {
                logger.debug("Lesson {} discarded answer to a question no longer pending", lessonId);
                return;
            }
            state.pendingQuestion(null);
            hub.broadcast(event(EventType.QUESTION_ANSWERED)
                    .with("question", question.question())
                    .with("answer_text", answer.answerText())
                    .with("audio_ref", answer.audioRef())
                    .with("found", answer.found()));
        }
        collaborators.lessonStore()
                .recordAnswer(lessonId, question, answer, processingTimeMs)
                .onErrorResume(e -> {
                    logger.warn("Could not record answer for lesson {}: {}", lessonId, e.getMessage());
                    return Mono.empty();
                })
                .subscribe();
    }

    private void onCompleted(Instant completedAt) {
        inflight.dispose();
        collaborators.lessonStore()
                .markCompleted(lessonId, LocalDateTime.ofInstant(completedAt, clock.getZone()))
                .onErrorResume(e -> {
                    logger.warn("Could not mark lesson {} completed: {}", lessonId, e.getMessage());
                    return Mono.empty();
                })
                .subscribe();
        completionListener.accept(lessonId);
    }

    /**
     * Subscribe to a collaborator call, keeping it cancellable until it terminates.
     * Once the session has completed the call is cancelled straight away.
     */
    private <T> void track(Flux<T> call, Consumer<? super T> onResult) {
        Disposable.Swap slot = Disposables.swap();
        if (!inflight.add(slot)) {
            return;
        }
        slot.update(call.doFinally(signal -> inflight.remove(slot)).subscribe(onResult));
    }

    int inflightCount() {
        return inflight.size();
    }

    private LessonEvent pausedEvent() {
        return event(EventType.PRESENTATION_PAUSED)
                .with("current_slide", state.currentSlide())
                .with("paused_at", state.pausedAt());
    }

    private LessonEvent resumedEvent() {
        return event(EventType.PRESENTATION_RESUMED).with("current_slide", state.currentSlide());
    }

    private LessonEvent event(EventType type) {
        return LessonEvent.of(type, clock.instant());
    }

    private record LoadedPresentation(int totalSlides, SlideContent firstSlide) {
    }

    private record Transition(CommandOutcome outcome, Runnable followUp) {

        static final Runnable NOTHING = () -> { };

        static Transition applied() {
            return new Transition(CommandOutcome.applied(), NOTHING);
        }

        static Transition applied(Runnable followUp) {
            return new Transition(CommandOutcome.applied(), followUp);
        }

        static Transition unchanged() {
            return new Transition(CommandOutcome.unchanged(), NOTHING);
        }

        static Transition unchanged(Runnable followUp) {
            return new Transition(CommandOutcome.unchanged(), followUp);
        }
    }
}
