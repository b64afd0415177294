package com.eyelevel.documentanalyzer.service.document;

import com.eyelevel.documentanalyzer.dto.upload.UploadResponse;
import com.eyelevel.documentanalyzer.exception.FileStorageException;
import com.eyelevel.documentanalyzer.exception.InvalidUploadException;
import com.eyelevel.documentanalyzer.model.FinancialDocument;
import com.eyelevel.documentanalyzer.service.job.JobDispatchService;
import com.eyelevel.documentanalyzer.service.storage.FileStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Entry point of the upload surface. Stores the file, creates the PENDING document, reserves its
 * job and records the job ID, all before the job is dispatched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    private final UploadValidationService uploadValidationService;
    private final FileStorageService fileStorageService;
    private final DocumentRecordService documentRecordService;
    private final JobDispatchService jobDispatchService;

    @Transactional
    public UploadResponse ingest(final String originalFilename, final byte[] content) {
        final String validationError = uploadValidationService.validateUpload(originalFilename, content.length);
        if (validationError != null) {
            log.warn("Rejected upload '{}': {}", originalFilename, validationError);
            throw new InvalidUploadException(validationError);
        }

        final String filename = resolveFilename(originalFilename);
        final Path storedFile = storeFile(filename, content);
        deleteOnRollback(storedFile);

        final FinancialDocument document = documentRecordService.createRecord(filename);
        final String jobId = jobDispatchService.submit(document.getId(), storedFile.toString());
        documentRecordService.assignJobId(document.getId(), jobId);

        log.info("Accepted upload '{}' as Document ID: {} with job {}", filename, document.getId(), jobId);
        return new UploadResponse(jobId, document.getId());
    }

    private Path storeFile(final String filename, final byte[] content) {
        try {
            return fileStorageService.store(FileStorageService.buildStoredName(filename), content);
        } catch (final IOException e) {
            log.error("Failed to save uploaded file '{}'", filename, e);
            throw new FileStorageException("Failed to save uploaded file: " + e.getMessage(), e);
        }
    }

    private void deleteOnRollback(final Path storedFile) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    fileStorageService.delete(storedFile);
                }
            }
        });
    }

    private static String resolveFilename(final String originalFilename) {
        final String baseName = originalFilename == null ? null : FilenameUtils.getName(originalFilename).trim();
        return StringUtils.hasText(baseName) ? baseName : "upload-" + UUID.randomUUID();
    }
}
