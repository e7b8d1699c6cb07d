package com.classroomai.collaborator;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Processed presentation description written by the presentation pipeline,
 * one file per lesson.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PresentationMetadata(
        @JsonProperty("total_slides") int totalSlides,
        @JsonProperty("slides") List<Slide> slides) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Slide(
            @JsonProperty("slide_number") int slideNumber,
            @JsonProperty("text") String text,
            @JsonProperty("audio_path") String audioPath,
            @JsonProperty("image_path") String imagePath) {
    }
}
