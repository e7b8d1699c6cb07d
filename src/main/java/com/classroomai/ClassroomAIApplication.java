package com.classroomai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Lesson session orchestrator: runs scheduled lessons through attendance, presentation
 * and Q&A while keeping every connected display in sync over WebSocket.
 */
@SpringBootApplication
@EnableScheduling
public class ClassroomAIApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClassroomAIApplication.class, args);
    }
}
