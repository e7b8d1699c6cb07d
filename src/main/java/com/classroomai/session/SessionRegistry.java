package com.classroomai.session;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * The set of active lesson sessions. At most one actor exists per lesson; a completed
 * session stays reachable for a short linger period and is then torn down.
 */
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<Long, SessionActor> sessions = new ConcurrentHashMap<>();
    private final SessionActorFactory factory;
    private final Duration teardownLinger;
    private final Scheduler scheduler;

    public SessionRegistry(SessionActorFactory factory, Duration teardownLinger, Scheduler scheduler) {
        this.factory = factory;
        this.teardownLinger = teardownLinger;
        this.scheduler = scheduler;
    }

    /**
     * Return the lesson's actor, creating it if none is active.
     */
    public StartResult getOrCreate(long lessonId) {
        boolean[] created = {false};
        SessionActor actor = sessions.computeIfAbsent(lessonId, id -> {
            created[0] = true;
            return factory.create(id, this::scheduleTeardown);
        });
        if (created[0]) {
            logger.info("Session created for lesson {} ({} active)", lessonId, sessions.size());
        } else {
            logger.debug("Session for lesson {} already active", lessonId);
        }
        return new StartResult(actor, created[0]);
    }

    public Optional<SessionActor> find(long lessonId) {
        return Optional.ofNullable(sessions.get(lessonId));
    }

    public boolean exists(long lessonId) {
        return sessions.containsKey(lessonId);
    }

    /**
     * Remove the lesson's actor immediately and close its connections.
     */
    public boolean remove(long lessonId) {
        SessionActor actor = sessions.remove(lessonId);
        if (actor == null) {
            return false;
        }
        actor.close();
        logger.info("Session torn down for lesson {} ({} active)", lessonId, sessions.size());
        return true;
    }

    public List<Long> activeLessonIds() {
        return sessions.keySet().stream().sorted().toList();
    }

    public int activeCount() {
        return sessions.size();
    }

    private void scheduleTeardown(long lessonId) {
        SessionActor actor = sessions.get(lessonId);
        logger.debug("Teardown of lesson {} scheduled in {} ms", lessonId, teardownLinger.toMillis());
        Mono.delay(teardownLinger, scheduler)
                .subscribe(tick -> {
                    // a newer session for the same lesson stays
                    if (actor != null && sessions.remove(lessonId, actor)) {
                        actor.close();
                        logger.info("Session torn down for lesson {} ({} active)", lessonId, sessions.size());
                    }
                });
    }

    public record StartResult(SessionActor actor, boolean created) {
    }
}
