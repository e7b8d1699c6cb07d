package com.classroomai.service;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.classroomai.dto.CommandOutcome;
import com.classroomai.dto.CommandType;
import com.classroomai.dto.ErrorResponse.ErrorCode;
import com.classroomai.dto.LessonCommand;
import com.classroomai.dto.LessonEvent;
import com.classroomai.exception.LessonException;
import com.classroomai.model.QuestionMethod;
import com.classroomai.session.LessonConnection;
import com.classroomai.session.SessionActor;
import com.classroomai.session.SessionRegistry;
import com.classroomai.validation.InputValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Translates inbound wire messages into typed commands and hands them to the lesson's actor.
 */
@Service
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final SessionRegistry registry;
    private final InputValidator inputValidator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CommandDispatcher(SessionRegistry registry, InputValidator inputValidator,
                             ObjectMapper objectMapper, Clock clock) {
        this.registry = registry;
        this.inputValidator = inputValidator;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Parse {@code {"type": ..., ...}} into a command.
     * @throws LessonException with a CMD_ or VAL_ code when the message is unusable
     */
    public LessonCommand parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new LessonException(ErrorCode.CMD_006, "Message is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw new LessonException(ErrorCode.CMD_006, "Message must be a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new LessonException(ErrorCode.CMD_001);
        }
        String typeName = typeNode.asText();
        CommandType type = CommandType.fromWire(typeName)
                .orElseThrow(() -> new LessonException(ErrorCode.CMD_002, typeName));

        if (type != CommandType.ASK_QUESTION) {
            return LessonCommand.of(type);
        }

        JsonNode questionNode = root.get("question");
        String question = inputValidator.validateQuestion(
                questionNode != null && questionNode.isTextual() ? questionNode.asText() : null);

        JsonNode methodNode = root.get("method");
        QuestionMethod method = QuestionMethod.TEXT;
        if (methodNode != null && !methodNode.isNull()) {
            method = QuestionMethod.fromWire(methodNode.asText())
                    .orElseThrow(() -> new LessonException(ErrorCode.VAL_004, "method must be 'text' or 'audio'"));
        }
        return LessonCommand.askQuestion(question, method);
    }

    /**
     * Parse and apply a message received on a connection.
     * Protocol errors are answered on that connection only.
     */
    public CommandOutcome dispatch(long lessonId, String payload, LessonConnection origin) {
        SessionActor actor = registry.find(lessonId).orElse(null);
        if (actor == null) {
            logger.debug("Message for lesson {} without an active session", lessonId);
            return CommandOutcome.rejected(ErrorCode.LESSON_004, "No active session for lesson " + lessonId);
        }
        LessonCommand command;
        try {
            command = parse(payload);
        } catch (LessonException e) {
            logger.debug("Rejected message on lesson {}: {}", lessonId, e.getMessage());
            actor.hub().sendTo(origin, LessonEvent.error(e.getErrorCode(), e.getMessage(), clock.instant()));
            return CommandOutcome.rejected(e.getErrorCode(), e.getMessage());
        }
        return actor.submit(command, origin);
    }

    /**
     * Apply a command issued by the server itself (REST end, scheduler).
     */
    public CommandOutcome dispatchSystem(long lessonId, LessonCommand command) {
        SessionActor actor = registry.find(lessonId)
                .orElseThrow(() -> new LessonException(ErrorCode.LESSON_004, "lesson " + lessonId));
        return actor.submit(command, null);
    }
}
