package com.classroomai.collaborator;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import reactor.core.publisher.Flux;

/**
 * Attendance scanner backed by the face recognition service.
 * POST /attendance/scan with {@code {"lesson_id": id}}, answered by a JSON array of matches.
 */
@Component
public class HttpAttendanceScanner implements AttendanceScanner {

    private static final Logger logger = LoggerFactory.getLogger(HttpAttendanceScanner.class);

    private final WebClient webClient;

    public HttpAttendanceScanner(@Qualifier("attendanceWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Flux<AttendanceMatch> scan(long lessonId) {
        return webClient.post()
                .uri("/attendance/scan")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("lesson_id", lessonId))
                .retrieve()
                .bodyToFlux(AttendanceMatch.class)
                .doOnSubscribe(s -> logger.debug("Attendance scan requested for lesson {}", lessonId))
                .doOnError(e -> logger.warn("Attendance scan failed for lesson {}: {}", lessonId, e.getMessage()));
    }
}
