package com.classroomai.session;

import com.classroomai.collaborator.AnswerService;
import com.classroomai.collaborator.AttendanceScanner;
import com.classroomai.collaborator.LessonStore;
import com.classroomai.collaborator.PresentationStore;

/**
 * External services a session calls out to.
 */
public record SessionCollaborators(
        AttendanceScanner attendanceScanner,
        PresentationStore presentationStore,
        AnswerService answerService,
        LessonStore lessonStore) {
}
