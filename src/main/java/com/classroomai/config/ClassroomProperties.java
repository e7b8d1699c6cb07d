package com.classroomai.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for lesson sessions, the auto-start scheduler and collaborators
 * Binds to classroom.* properties in application.yml. Durations are in milliseconds.
 */
@Configuration
@ConfigurationProperties(prefix = "classroom")
public class ClassroomProperties {

    private Session session = new Session();
    private Scheduler scheduler = new Scheduler();
    private Websocket websocket = new Websocket();
    private Collaborators collaborators = new Collaborators();

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Websocket getWebsocket() {
        return websocket;
    }

    public void setWebsocket(Websocket websocket) {
        this.websocket = websocket;
    }

    public Collaborators getCollaborators() {
        return collaborators;
    }

    public void setCollaborators(Collaborators collaborators) {
        this.collaborators = collaborators;
    }

    public static class Session {
        private long collaboratorTimeout = 20000; // 20 seconds
        private long answerTimeout = 30000;       // 30 seconds
        private long teardownLinger = 5000;       // 5 seconds
        private int outboundBufferSize = 256;
        private int maxQuestionLength = 1000;

        public long getCollaboratorTimeout() {
            return collaboratorTimeout;
        }

        public void setCollaboratorTimeout(long collaboratorTimeout) {
            this.collaboratorTimeout = collaboratorTimeout;
        }

        public long getAnswerTimeout() {
            return answerTimeout;
        }

        public void setAnswerTimeout(long answerTimeout) {
            this.answerTimeout = answerTimeout;
        }

        public long getTeardownLinger() {
            return teardownLinger;
        }

        public void setTeardownLinger(long teardownLinger) {
            this.teardownLinger = teardownLinger;
        }

        public int getOutboundBufferSize() {
            return outboundBufferSize;
        }

        public void setOutboundBufferSize(int outboundBufferSize) {
            this.outboundBufferSize = outboundBufferSize;
        }

        public int getMaxQuestionLength() {
            return maxQuestionLength;
        }

        public void setMaxQuestionLength(int maxQuestionLength) {
            this.maxQuestionLength = maxQuestionLength;
        }

        public Duration collaboratorTimeout() {
            return Duration.ofMillis(collaboratorTimeout);
        }

        public Duration answerTimeout() {
            return Duration.ofMillis(answerTimeout);
        }

        public Duration teardownLinger() {
            return Duration.ofMillis(teardownLinger);
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long pollInterval = 30000; // 30 seconds
        private long initialDelay = 5000;  // 5 seconds
        private long startWindow = 300000; // 5 minutes

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(long pollInterval) {
            this.pollInterval = pollInterval;
        }

        public long getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(long initialDelay) {
            this.initialDelay = initialDelay;
        }

        public long getStartWindow() {
            return startWindow;
        }

        public void setStartWindow(long startWindow) {
            this.startWindow = startWindow;
        }

        public Duration startWindow() {
            return Duration.ofMillis(startWindow);
        }
    }

    public static class Websocket {
        private int maxFrameSize = 65536; // 64KB

        public int getMaxFrameSize() {
            return maxFrameSize;
        }

        public void setMaxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
        }
    }

    public static class Collaborators {
        private Endpoint attendance = new Endpoint("http://localhost:8001");
        private Endpoint answer = new Endpoint("http://localhost:8002");
        private Presentation presentation = new Presentation();

        public Endpoint getAttendance() {
            return attendance;
        }

        public void setAttendance(Endpoint attendance) {
            this.attendance = attendance;
        }

        public Endpoint getAnswer() {
            return answer;
        }

        public void setAnswer(Endpoint answer) {
            this.answer = answer;
        }

        public Presentation getPresentation() {
            return presentation;
        }

        public void setPresentation(Presentation presentation) {
            this.presentation = presentation;
        }
    }

    public static class Endpoint {
        private String baseUrl;

        public Endpoint() {
        }

        public Endpoint(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Presentation {
        private String metadataDir = "uploads/presentations";

        public String getMetadataDir() {
            return metadataDir;
        }

        public void setMetadataDir(String metadataDir) {
            this.metadataDir = metadataDir;
        }
    }
}
