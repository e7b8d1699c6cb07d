package com.classroomai.collaborator;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Content of one slide. Audio and image references may be null.
 */
public record SlideContent(
        @JsonProperty("slide_number") int slideNumber,
        @JsonProperty("text") String text,
        @JsonProperty("audio_ref") String audioRef,
        @JsonProperty("image_ref") String imageRef) {

    /**
     * Stand-in used when a slide could not be fetched in time.
     */
    public static SlideContent placeholder(int slideNumber) {
        return new SlideContent(slideNumber, null, null, null);
    }
}
