package com.classroomai.collaborator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.classroomai.config.ClassroomProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Reads processed presentations from {@code lesson_{id}_presentation_metadata.json}
 * files in the configured metadata directory. File access runs on the bounded elastic scheduler.
 */
@Component
public class FileSystemPresentationStore implements PresentationStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemPresentationStore.class);

    private final Path metadataDir;
    private final ObjectMapper objectMapper;

    public FileSystemPresentationStore(ClassroomProperties properties, ObjectMapper objectMapper) {
        this.metadataDir = Paths.get(properties.getCollaborators().getPresentation().getMetadataDir());
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Integer> slideCount(long lessonId) {
        return Mono.fromCallable(() -> load(lessonId)
                        .map(PresentationMetadata::totalSlides)
                        .orElse(0))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<SlideContent> slide(long lessonId, int index) {
        return Mono.fromCallable(() -> {
                    PresentationMetadata metadata = load(lessonId)
                            .orElseThrow(() -> new NoSuchElementException("No presentation for lesson " + lessonId));
                    return metadata.slides().stream()
                            .filter(s -> s.slideNumber() == index)
                            .findFirst()
                            .map(s -> new SlideContent(s.slideNumber(), s.text(), s.audioPath(), s.imagePath()))
                            .orElseThrow(() -> new NoSuchElementException(
                                    "Slide " + index + " not found for lesson " + lessonId));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    Path metadataPath(long lessonId) {
        return metadataDir.resolve("lesson_" + lessonId + "_presentation_metadata.json");
    }

    private Optional<PresentationMetadata> load(long lessonId) throws IOException {
        Path path = metadataPath(lessonId);
        if (!Files.exists(path)) {
            logger.debug("No presentation metadata at {}", path);
            return Optional.empty();
        }
        PresentationMetadata metadata = objectMapper.readValue(path.toFile(), PresentationMetadata.class);
        if (metadata.slides() == null) {
            return Optional.of(new PresentationMetadata(0, List.of()));
        }
        return Optional.of(metadata);
    }
}
