package com.classroomai.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A question asked during a lesson and the answer that was delivered for it.
 */
@Table("qa_records")
public class QaRecord {

    @Id
    private Long id;

    @Column("lesson_id")
    private Long lessonId;

    @Column("question_text")
    private String questionText;

    @Column("question_method")
    private String questionMethod;

    @Column("answer_text")
    private String answerText;

    @Column("answer_audio_ref")
    private String answerAudioRef;

    @Column("found_answer")
    private Boolean foundAnswer = false;

    @Column("processing_time_ms")
    private Long processingTimeMs;

    @Column("asked_at")
    private LocalDateTime askedAt;

    public QaRecord() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final QaRecord record = new QaRecord();

        public Builder lessonId(long lessonId) {
            record.lessonId = lessonId;
            return this;
        }

        public Builder question(String text, QuestionMethod method) {
            record.questionText = text;
            record.questionMethod = method.wireName();
            return this;
        }

        public Builder answer(String text, String audioRef, boolean found) {
            record.answerText = text;
            record.answerAudioRef = audioRef;
            record.foundAnswer = found;
            return this;
        }

        public Builder processingTimeMs(long millis) {
            record.processingTimeMs = millis;
            return this;
        }

        public Builder askedAt(LocalDateTime askedAt) {
            record.askedAt = askedAt;
            return this;
        }

        public QaRecord build() {
            return record;
        }
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getLessonId() {
        return lessonId;
    }

    public void setLessonId(Long lessonId) {
        this.lessonId = lessonId;
    }

    public String getQuestionText() {
        return questionText;
    }

    public void setQuestionText(String questionText) {
        this.questionText = questionText;
    }

    public String getQuestionMethod() {
        return questionMethod;
    }

    public void setQuestionMethod(String questionMethod) {
        this.questionMethod = questionMethod;
    }

    public String getAnswerText() {
        return answerText;
    }

    public void setAnswerText(String answerText) {
        this.answerText = answerText;
    }

    public String getAnswerAudioRef() {
        return answerAudioRef;
    }

    public void setAnswerAudioRef(String answerAudioRef) {
        this.answerAudioRef = answerAudioRef;
    }

    public Boolean getFoundAnswer() {
        return foundAnswer;
    }

    public void setFoundAnswer(Boolean foundAnswer) {
        this.foundAnswer = foundAnswer;
    }

    public Long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(Long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }

    public LocalDateTime getAskedAt() {
        return askedAt;
    }

    public void setAskedAt(LocalDateTime askedAt) {
        this.askedAt = askedAt;
    }
}
