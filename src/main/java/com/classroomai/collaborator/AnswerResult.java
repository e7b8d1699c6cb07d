package com.classroomai.collaborator;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer produced for a question.
 */
public record AnswerResult(
        @JsonProperty("answer_text") String answerText,
        @JsonProperty("audio_ref") String audioRef,
        @JsonProperty("found") boolean found) {

    public static final String NOT_FOUND_TEXT = "No answer found for this question.";

    public static AnswerResult notFound() {
        return new AnswerResult(NOT_FOUND_TEXT, null, false);
    }
}
