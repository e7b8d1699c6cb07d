package com.classroomai.collaborator;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.classroomai.model.QuestionMethod;

import reactor.core.publisher.Mono;

/**
 * Answer service backed by the retrieval and speech pipeline.
 * POST /answer with {@code {"lesson_id", "question", "method"}}.
 */
@Component
public class HttpAnswerService implements AnswerService {

    private static final Logger logger = LoggerFactory.getLogger(HttpAnswerService.class);

    private final WebClient webClient;

    public HttpAnswerService(@Qualifier("answerWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<AnswerResult> answer(long lessonId, String question, QuestionMethod method) {
        Map<String, Object> body = new HashMap<>();
        body.put("lesson_id", lessonId);
        body.put("question", question);
        body.put("method", method.wireName());

        return webClient.post()
                .uri("/answer")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(AnswerResult.class)
                .doOnNext(result -> logger.debug("Answer for lesson {} found={}", lessonId, result.found()))
                .doOnError(e -> logger.warn("Answer generation failed for lesson {}: {}", lessonId, e.getMessage()));
    }
}
