package com.eyelevel.documentanalyzer.service.document;

import com.eyelevel.documentanalyzer.config.DocumentProcessingConfig;
import com.eyelevel.documentanalyzer.dto.document.DocumentResponse;
import com.eyelevel.documentanalyzer.exception.DocumentNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the document store, used by the query endpoints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentQueryService {

    private final DocumentRecordService documentRecordService;
    private final DocumentProcessingConfig config;

    public DocumentResponse getDocument(final Long documentId) {
        return documentRecordService.getRecord(documentId)
                                    .map(DocumentResponse::from)
                                    .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    /**
     * Lists documents in ID order. A missing or non-positive limit falls back to the configured
     * default; larger limits are capped at the configured maximum.
     */
    public List<DocumentResponse> listDocuments(final int skip, final Integer limit) {
        final DocumentProcessingConfig.Query query = config.getQuery();
        final int effectiveLimit = limit == null || limit <= 0 ? query.getDefaultLimit()
                                                               : Math.min(limit, query.getMaxLimit());
        log.debug("Listing documents with skip={}, limit={}", skip, effectiveLimit);
        return documentRecordService.listRecords(Math.max(skip, 0), effectiveLimit)
                                    .stream()
                                    .map(DocumentResponse::from)
                                    .toList();
    }
}
