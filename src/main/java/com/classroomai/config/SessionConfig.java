package com.classroomai.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.classroomai.collaborator.AnswerService;
import com.classroomai.collaborator.AttendanceScanner;
import com.classroomai.collaborator.LessonStore;
import com.classroomai.collaborator.PresentationStore;
import com.classroomai.session.SessionActorFactory;
import com.classroomai.session.SessionCollaborators;
import com.classroomai.session.SessionRegistry;

import reactor.core.scheduler.Schedulers;

/**
 * Wiring for the in-memory session layer.
 */
@Configuration
public class SessionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SessionCollaborators sessionCollaborators(AttendanceScanner attendanceScanner,
                                                     PresentationStore presentationStore,
                                                     AnswerService answerService,
                                                     LessonStore lessonStore) {
        return new SessionCollaborators(attendanceScanner, presentationStore, answerService, lessonStore);
    }

    @Bean
    public SessionRegistry sessionRegistry(SessionActorFactory factory, ClassroomProperties properties) {
        return new SessionRegistry(factory, properties.getSession().teardownLinger(), Schedulers.parallel());
    }
}
