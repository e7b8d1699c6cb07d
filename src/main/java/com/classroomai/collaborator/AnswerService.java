package com.classroomai.collaborator;

import com.classroomai.model.QuestionMethod;

import reactor.core.publisher.Mono;

/**
 * Answer generation for questions asked during a lesson.
 * Callers bound the returned {@link Mono} with their own timeout.
 */
public interface AnswerService {

    Mono<AnswerResult> answer(long lessonId, String question, QuestionMethod method);
}
