package com.classroomai.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A question whose answer is being generated.
 * For {@link QuestionMethod#AUDIO} the question field holds the audio reference.
 */
public record PendingQuestion(
        @JsonProperty("question") String question,
        @JsonProperty("method") QuestionMethod method,
        @JsonProperty("asked_by") String askedBy,
        @JsonProperty("asked_at") Instant askedAt) {
}
