package com.eyelevel.documentanalyzer.service.document;

import com.eyelevel.documentanalyzer.model.DocumentStatus;
import com.eyelevel.documentanalyzer.model.FinancialDocument;
import com.eyelevel.documentanalyzer.model.ParsedFields;
import com.eyelevel.documentanalyzer.repository.FinancialDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * The record store for {@link FinancialDocument}s.
 * <p>
 * Terminal transitions run in their own transaction as a single guarded {@code UPDATE}, so a
 * concurrent reader sees either the PENDING row or the complete terminal row and never a mix.
 * A document that has already left PENDING is never written again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentRecordService {

    private final FinancialDocumentRepository documentRepository;

    /**
     * Creates a PENDING document with empty text. Joins the caller's transaction so that the row
     * commits together with the job reservation.
     */
    @Transactional
    public FinancialDocument createRecord(final String filename) {
        final FinancialDocument document = FinancialDocument.builder()
                                                            .filename(filename)
                                                            .rawText("")
                                                            .parsedFields(ParsedFields.empty())
                                                            .status(DocumentStatus.PENDING)
                                                            .build();
        final FinancialDocument saved = documentRepository.saveAndFlush(document);
        log.info("Created PENDING document ID: {} for file '{}'", saved.getId(), filename);
        return saved;
    }

    /**
     * Records the dispatched job on the document. The job ID can be set once only.
     *
     * @throws IllegalStateException if the document is missing or already carries a different job ID.
     */
    @Transactional
    public void assignJobId(final Long documentId, final String jobId) {
        final FinancialDocument document = documentRepository.findById(documentId).orElseThrow(
                () -> new IllegalStateException("Cannot assign job: Document not found with ID " + documentId));
        if (document.getJobId() != null && !document.getJobId().equals(jobId)) {
            throw new IllegalStateException(String.format("Document ID %d already has job %s; refusing to assign %s",
                                                          documentId, document.getJobId(), jobId));
        }
        document.setJobId(jobId);
    }

    @Transactional(readOnly = true)
    public Optional<FinancialDocument> getRecord(final Long documentId) {
        return documentRepository.findById(documentId);
    }

    @Transactional(readOnly = true)
    public List<FinancialDocument> listRecords(final int offset, final int limit) {
        return documentRepository.findSlice(offset, limit);
    }

    /**
     * Stores the decoded text and all four parsed fields and moves the document to SUCCESS,
     * in one statement and a new transaction.
     *
     * @return {@code true} if the document was PENDING and has been updated.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markSucceeded(final Long documentId, final String rawText, final ParsedFields fields) {
        final int updated = documentRepository.markSucceeded(documentId, rawText, fields.getVendor(),
                                                             fields.getInvoiceNo(), fields.getInvoiceDate(),
                                                             fields.getTotal(), DocumentStatus.SUCCESS,
                                                             DocumentStatus.PENDING, LocalDateTime.now());
        if (updated == 0) {
            log.warn("Document ID {} was not PENDING; SUCCESS transition rejected.", documentId);
            return false;
        }
        log.debug("Document ID {} moved to SUCCESS.", documentId);
        return true;
    }

    /**
     * Moves the document to FAILED in a new transaction, leaving text and parsed fields empty.
     *
     * @return {@code true} if the document was PENDING and has been updated.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(final Long documentId, final String reason) {
        final int updated = documentRepository.markFailed(documentId, reason, DocumentStatus.FAILED,
                                                          DocumentStatus.PENDING, LocalDateTime.now());
        if (updated == 0) {
            log.warn("Document ID {} was not PENDING; FAILED transition skipped. Reason was: {}", documentId, reason);
            return false;
        }
        log.info("Document ID {} moved to FAILED. Reason: {}", documentId, reason);
        return true;
    }
}
