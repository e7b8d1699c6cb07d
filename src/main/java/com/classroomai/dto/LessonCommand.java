package com.classroomai.dto;

import com.classroomai.model.QuestionMethod;

/**
 * A validated command for one lesson. Only {@link CommandType#ASK_QUESTION} carries a question.
 */
public record LessonCommand(CommandType type, String question, QuestionMethod method) {

    public static LessonCommand of(CommandType type) {
        return new LessonCommand(type, null, null);
    }

    public static LessonCommand askQuestion(String question, QuestionMethod method) {
        return new LessonCommand(CommandType.ASK_QUESTION, question, method);
    }
}
