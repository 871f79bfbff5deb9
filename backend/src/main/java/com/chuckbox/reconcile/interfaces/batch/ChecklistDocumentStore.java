package com.chuckbox.reconcile.interfaces.batch;

import com.chuckbox.reconcile.interfaces.batch.dto.AuthoritativeIdDocument;
import com.chuckbox.reconcile.interfaces.batch.dto.VisualScrapeDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads and saves the JSON documents exchanged with the batch callers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChecklistDocumentStore {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public AuthoritativeIdDocument loadIdentifiers(Path path) {
        if (!Files.exists(path)) {
            throw new ChecklistDocumentException("Identifier document not found: " + path);
        }
        AuthoritativeIdDocument document = read(path, AuthoritativeIdDocument.class);
        validate(path, document);
        log.info("Loaded {} identifier versions from {}", document.badges().size(), path);
        return document;
    }

    /**
     * Load the visual-scrape document. A missing file is not an error: the caller
     * falls back to identifier-only output.
     */
    public Optional<VisualScrapeDocument> loadScrape(Path path) {
        if (!Files.exists(path)) {
            log.warn("No visual-scrape document at {}; proceeding with identifiers only", path);
            return Optional.empty();
        }
        VisualScrapeDocument document = read(path, VisualScrapeDocument.class);
        validate(path, document);
        log.info("Loaded {} scraped versions from {}", document.badges().size(), path);
        return Optional.of(document);
    }

    public void write(Path path, Object document) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(path.toFile(), document);
        } catch (IOException e) {
            throw new ChecklistDocumentException("Failed to write " + path, e);
        }
    }

    private <T> T read(Path path, Class<T> type) {
        try {
            T document = objectMapper.readValue(path.toFile(), type);
            if (document == null) {
                throw new ChecklistDocumentException("Empty document: " + path);
            }
            return document;
        } catch (IOException e) {
            throw new ChecklistDocumentException("Failed to parse " + path + ": " + e.getMessage(), e);
        }
    }

    private <T> void validate(Path path, T document) {
        Set<ConstraintViolation<T>> violations = validator.validate(document);
        if (violations.isEmpty()) {
            return;
        }
        String details = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .collect(Collectors.joining("; "));
        throw new ChecklistDocumentException("Invalid document " + path + ": " + details);
    }
}
