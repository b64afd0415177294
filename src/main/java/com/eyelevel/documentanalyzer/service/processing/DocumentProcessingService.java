package com.eyelevel.documentanalyzer.service.processing;

import com.eyelevel.documentanalyzer.exception.DocumentProcessingException;
import com.eyelevel.documentanalyzer.extraction.FieldExtractor;
import com.eyelevel.documentanalyzer.model.ParsedFields;
import com.eyelevel.documentanalyzer.service.document.DocumentRecordService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Drives one document through its single extraction attempt:
 * {@code PENDING -> SUCCESS} or {@code PENDING -> FAILED}. There is no retry here; a failed
 * document stays failed and a new upload is needed to try again.
 * <p>
 * The service is safe to run concurrently for different documents. It relies on the dispatcher
 * for at most one invocation per document.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentProcessingService {

    private final DocumentRecordService documentRecordService;
    private final FieldExtractor fieldExtractor;

    /**
     * Reads the file, extracts its fields and moves the document to its terminal status.
     *
     * @param documentId the document to process.
     * @param filePath   where the uploaded content was stored.
     * @return how the run ended. Missing documents and files are reported here, not thrown.
     * @throws DocumentProcessingException if reading, extracting or persisting failed. The document
     *                                     has been moved to FAILED on a best-effort basis.
     */
    public ExtractionOutcome process(final Long documentId, final String filePath) {
        log.info("Beginning extraction for Document ID: {} from '{}'", documentId, filePath);

        if (documentRecordService.getRecord(documentId).isEmpty()) {
            log.warn("Document ID {} does not exist. Nothing to process.", documentId);
            return ExtractionOutcome.recordNotFound(documentId);
        }

        final Path path = toPath(filePath);
        if (path == null || !Files.isRegularFile(path)) {
            log.error("File '{}' for Document ID {} does not exist. Marking document as FAILED.", filePath, documentId);
            final ExtractionOutcome outcome = ExtractionOutcome.fileNotFound(documentId, filePath);
            documentRecordService.markFailed(documentId, outcome.getMessage());
            return outcome;
        }

        try {
            final Utf8TextDecoder.DecodedText decoded = Utf8TextDecoder.decode(Files.readAllBytes(path));
            if (decoded.lossy()) {
                log.warn("File '{}' for Document ID {} is not valid UTF-8. Continuing with replacement characters.",
                         filePath, documentId);
            }

            if (decoded.text().isEmpty()) {
                log.warn("File '{}' for Document ID {} is empty. Marking document as FAILED.", filePath, documentId);
                final ExtractionOutcome outcome = ExtractionOutcome.emptyContent(documentId);
                documentRecordService.markFailed(documentId, outcome.getMessage());
                return outcome;
            }

            final ParsedFields fields = fieldExtractor.extract(decoded.text());
            if (!documentRecordService.markSucceeded(documentId, decoded.text(), fields)) {
                throw new DocumentProcessingException("Document ID " + documentId + " is no longer PENDING");
            }

            log.info("Extraction completed for Document ID: {}. Fields: {}", documentId, fields);
            return ExtractionOutcome.success(documentId, fields);
        } catch (final Exception e) {
            log.error("Extraction failed for Document ID: {}. Marking document as FAILED.", documentId, e);
            markFailedAfterError(documentId, e);
            throw new DocumentProcessingException("Extraction failed for Document ID " + documentId, e);
        }
    }

    private void markFailedAfterError(final Long documentId, final Exception cause) {
        try {
            documentRecordService.markFailed(documentId, describe(cause));
        } catch (final RuntimeException failure) {
            log.error("CRITICAL: Could not persist FAILED status for Document ID {}. The document may stay PENDING.",
                      documentId, failure);
            cause.addSuppressed(failure);
        }
    }

    private static String describe(final Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName()
                                      : e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static Path toPath(final String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return null;
        }
        try {
            return Path.of(filePath);
        } catch (final InvalidPathException e) {
            log.warn("Unusable file path '{}': {}", filePath, e.getMessage());
            return null;
        }
    }
}
