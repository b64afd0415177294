package com.eyelevel.documentanalyzer.service.storage;

import com.eyelevel.documentanalyzer.config.DocumentProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Keeps uploaded files on the local filesystem under {@code app.processing.storage.upload-dir}.
 * Each upload gets its own file; stored files are never overwritten.
 */
@Slf4j
@Service
public class FileStorageService {

    private final Path uploadDir;

    public FileStorageService(DocumentProcessingConfig config) {
        this.uploadDir = Path.of(config.getStorage().getUploadDir()).toAbsolutePath().normalize();
    }

    /**
     * Builds a unique, path-free name for an upload: {@code <uuid>-<base name>}.
     */
    public static String buildStoredName(final String filename) {
        return UUID.randomUUID() + "-" + FilenameUtils.getName(filename);
    }

    /**
     * Writes the content to a new file in the upload directory. Transient I/O errors are retried.
     *
     * @param storedName a name produced by {@link #buildStoredName(String)}.
     * @return the absolute path of the written file.
     * @throws IOException if the file could not be written after all attempts.
     */
    @Retryable(retryFor = {IOException.class},
            maxAttemptsExpression = "#{${app.processing.storage.retry.attempts:2} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.storage.retry.delay-ms:200}}"),
            listeners = {"storageRetryListener"})
    public Path store(final String storedName, final byte[] content) throws IOException {
        Files.createDirectories(uploadDir);
        final Path target = uploadDir.resolve(storedName).normalize();
        if (!target.startsWith(uploadDir)) {
            throw new IllegalArgumentException("Stored name escapes the upload directory: " + storedName);
        }
        try {
            writeContent(target, content);
        } catch (final FileAlreadyExistsException e) {
            throw e;
        } catch (final IOException e) {
            // A partial file would make every retry fail on CREATE_NEW.
            delete(target);
            throw e;
        }
        log.info("Stored {} bytes at '{}'", content.length, target);
        return target;
    }

    void writeContent(final Path target, final byte[] content) throws IOException {
        Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    /**
     * Removes a stored file, for uploads whose records were never committed or whose write failed.
     */
    public void delete(final Path storedFile) {
        try {
            if (Files.deleteIfExists(storedFile)) {
                log.info("Deleted orphaned upload '{}'", storedFile);
            }
        } catch (final IOException e) {
            log.warn("Could not delete orphaned upload '{}'", storedFile, e);
        }
    }

    public Path getUploadDir() {
        return uploadDir;
    }
}
