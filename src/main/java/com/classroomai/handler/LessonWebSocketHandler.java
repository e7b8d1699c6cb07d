package com.classroomai.handler;

import java.net.URI;
import java.time.Clock;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;

import com.classroomai.dto.CommandOutcome;
import com.classroomai.dto.ErrorResponse.ErrorCode;
import com.classroomai.dto.LessonEvent;
import com.classroomai.exception.LessonException;
import com.classroomai.model.ConnectionRecord;
import com.classroomai.security.WebSocketAuthHandler;
import com.classroomai.security.WebSocketAuthHandler.AuthenticatedUser;
import com.classroomai.service.CommandDispatcher;
import com.classroomai.session.LessonConnection;
import com.classroomai.session.SessionActor;
import com.classroomai.session.SessionRegistry;
import com.classroomai.validation.InputValidator;

import reactor.core.publisher.Mono;

/**
 * WebSocket endpoint for one lesson: {@code /ws/lesson/{lessonId}}.
 *
 * Close codes: 4000 invalid lesson id, 4001 missing or invalid token,
 * 4004 no active session for the lesson.
 */
@Component
public class LessonWebSocketHandler implements WebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(LessonWebSocketHandler.class);

    public static final String PATH_PATTERN = "/ws/lesson/*";

    static final CloseStatus INVALID_LESSON = new CloseStatus(4000, "Invalid lesson id");
    static final CloseStatus UNAUTHORIZED = new CloseStatus(4001, "Authentication required");
    static final CloseStatus NO_SESSION = new CloseStatus(4004, "No active session for lesson");

    private final SessionRegistry registry;
    private final CommandDispatcher dispatcher;
    private final WebSocketAuthHandler authHandler;
    private final InputValidator inputValidator;
    private final Clock clock;

    public LessonWebSocketHandler(SessionRegistry registry,
                                  CommandDispatcher dispatcher,
                                  WebSocketAuthHandler authHandler,
                                  InputValidator inputValidator,
                                  Clock clock) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.authHandler = authHandler;
        this.inputValidator = inputValidator;
        this.clock = clock;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        HandshakeInfo handshake = session.getHandshakeInfo();
        URI uri = handshake.getUri();

        long lessonId;
        try {
            lessonId = inputValidator.parseLessonId(lastSegment(uri.getPath()));
        } catch (LessonException e) {
            logger.warn("Rejected WebSocket {}: {}", session.getId(), e.getMessage());
            return session.close(INVALID_LESSON);
        }

        Optional<AuthenticatedUser> user = authHandler.authenticate(handshake.getHeaders(), queryParams(uri));
        if (user.isEmpty()) {
            logger.warn("Rejected WebSocket {} for lesson {}: no valid token", session.getId(), lessonId);
            return session.close(UNAUTHORIZED);
        }

        Optional<SessionActor> found = registry.find(lessonId);
        if (found.isEmpty() || found.get().isCompleted()) {
            logger.warn("Rejected WebSocket {}: no active session for lesson {}", session.getId(), lessonId);
            return session.close(NO_SESSION);
        }
        SessionActor actor = found.get();

        ConnectionRecord record = new ConnectionRecord(
                session.getId(), lessonId, user.get().connectionRole(), clock.instant());
        LessonConnection connection = actor.join(record);
        logger.debug("User {} connected to lesson {} as {}",
                user.get().username(), lessonId, record.role().wireName());

        Mono<Void> input = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .doOnNext(message -> handleText(lessonId, message.getPayloadAsText(), connection))
                .doOnError(error -> logger.error("Error receiving on lesson {}: {}", lessonId, error.getMessage()))
                .then();

        // outbound completes when the hub closes the connection; then close the socket
        Mono<Void> output = session.send(connection.outbound().map(session::textMessage))
                .then(session.close());

        return Mono.zip(input, output).then()
                .doFinally(signalType -> actor.leave(connection));
    }

    private void handleText(long lessonId, String payload, LessonConnection connection) {
        try {
            CommandOutcome outcome = dispatcher.dispatch(lessonId, payload, connection);
            if (outcome.isRejected()) {
                logger.debug("Command on lesson {} from {} rejected: {}",
                        lessonId, connection.id(), outcome.errorCode().getCode());
            }
        } catch (RuntimeException e) {
            logger.error("Error handling message on lesson {}: {}", lessonId, e.getMessage(), e);
            registry.find(lessonId).ifPresent(actor -> actor.hub().sendTo(connection,
                    LessonEvent.error(ErrorCode.SRV_001, "Message could not be processed", clock.instant())));
        }
    }

    static String lastSegment(String path) {
        if (path == null) {
            return null;
        }
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static MultiValueMap<String, String> queryParams(URI uri) {
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams();
    }
}
