package com.classroomai.collaborator;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.classroomai.config.ClassroomProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.test.StepVerifier;

class FileSystemPresentationStoreTest {

    private static final String METADATA = """
            {
              "lesson_id": 12,
              "total_slides": 2,
              "slides": [
                {"slide_number": 1, "text": "Photosynthesis", "audio_path": "audio/lesson_12_slide_1.mp3",
                 "image_path": "images/lesson_12_slide_1.png", "duration": 14.2},
                {"slide_number": 2, "text": "Chlorophyll", "audio_path": "audio/lesson_12_slide_2.mp3",
                 "image_path": "images/lesson_12_slide_2.png"}
              ]
            }
            """;

    @TempDir
    Path tempDir;

    private FileSystemPresentationStore store;

    @BeforeEach
    void setUp() {
        ClassroomProperties properties = new ClassroomProperties();
        properties.getCollaborators().getPresentation().setMetadataDir(tempDir.toString());
        store = new FileSystemPresentationStore(properties, new ObjectMapper());
    }

    @Test
    @DisplayName("Should read the slide count and slides of a processed presentation")
    void testReadsPresentation() throws Exception {
        Files.writeString(store.metadataPath(12L), METADATA);

        StepVerifier.create(store.slideCount(12L))
                .expectNext(2)
                .verifyComplete();

        StepVerifier.create(store.slide(12L, 2))
                .assertNext(slide -> {
                    assertEquals(2, slide.slideNumber());
                    assertEquals("Chlorophyll", slide.text());
                    assertEquals("audio/lesson_12_slide_2.mp3", slide.audioRef());
                    assertEquals("images/lesson_12_slide_2.png", slide.imageRef());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should report zero slides when no presentation was processed")
    void testMissingPresentation() {
        StepVerifier.create(store.slideCount(99L))
                .expectNext(0)
                .verifyComplete();

        StepVerifier.create(store.slide(99L, 1))
                .expectError(NoSuchElementException.class)
                .verify();
    }

    @Test
    @DisplayName("Should fail for a slide number the presentation does not have")
    void testMissingSlide() throws Exception {
        Files.writeString(store.metadataPath(12L), METADATA);

        StepVerifier.create(store.slide(12L, 3))
                .expectError(NoSuchElementException.class)
                .verify();
    }

    @Test
    @DisplayName("Should fail on an unreadable metadata file")
    void testCorruptMetadata() throws Exception {
        Files.writeString(store.metadataPath(13L), "{ not json");

        StepVerifier.create(store.slideCount(13L))
                .expectError()
                .verify();
    }
}
