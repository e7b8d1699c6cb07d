package com.classroomai.session;

import java.time.Clock;
import java.util.function.LongConsumer;

import org.springframework.stereotype.Component;

import com.classroomai.config.ClassroomProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds a session actor together with its connection hub.
 */
@Component
public class SessionActorFactory {

    private final SessionCollaborators collaborators;
    private final ClassroomProperties.Session settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SessionActorFactory(SessionCollaborators collaborators,
                               ClassroomProperties properties,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.collaborators = collaborators;
        this.settings = properties.getSession();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public SessionActor create(long lessonId, LongConsumer completionListener) {
        ConnectionHub hub = new ConnectionHub(lessonId, objectMapper, settings.getOutboundBufferSize());
        return new SessionActor(lessonId, hub, collaborators,
                settings.collaboratorTimeout(), settings.answerTimeout(), clock, completionListener);
    }
}
