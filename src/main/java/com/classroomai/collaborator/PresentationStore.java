package com.classroomai.collaborator;

import reactor.core.publisher.Mono;

/**
 * Source of processed slides for a lesson.
 */
public interface PresentationStore {

    /**
     * Number of slides, or 0 when the lesson has no processed presentation.
     */
    Mono<Integer> slideCount(long lessonId);

    /**
     * Content of the slide at a 1-based index.
     */
    Mono<SlideContent> slide(long lessonId, int index);
}
