package com.classroomai.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A student marked present during a lesson's attendance phase.
 */
@Table("attendance_records")
public class AttendanceRecord {

    public static final String FACE_RECOGNITION = "face_recognition";

    @Id
    private Long id;

    @Column("lesson_id")
    private Long lessonId;

    @Column("student_id")
    private Long studentId;

    @Column("recognition_confidence")
    private Double recognitionConfidence;

    @Column("entry_method")
    private String entryMethod = FACE_RECOGNITION;

    @Column("recorded_at")
    private LocalDateTime recordedAt;

    public AttendanceRecord() {
    }

    public AttendanceRecord(Long lessonId, Long studentId, Double recognitionConfidence, LocalDateTime recordedAt) {
        this.lessonId = lessonId;
        this.studentId = studentId;
        this.recognitionConfidence = recognitionConfidence;
        this.recordedAt = recordedAt;
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

    public Long getStudentId() {
        return studentId;
    }

    public void setStudentId(Long studentId) {
        this.studentId = studentId;
    }

    public Double getRecognitionConfidence() {
        return recognitionConfidence;
    }

    public void setRecognitionConfidence(Double recognitionConfidence) {
        this.recognitionConfidence = recognitionConfidence;
    }

    public String getEntryMethod() {
        return entryMethod;
    }

    public void setEntryMethod(String entryMethod) {
        this.entryMethod = entryMethod;
    }

    public LocalDateTime getRecordedAt() {
        return recordedAt;
    }

    public void setRecordedAt(LocalDateTime recordedAt) {
        this.recordedAt = recordedAt;
    }
}
