package com.eyelevel.documentanalyzer.dto.document;

import com.eyelevel.documentanalyzer.model.DocumentStatus;
import com.eyelevel.documentanalyzer.model.FinancialDocument;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Read model of a document. Always check {@code status}: a FAILED document and a SUCCESS
 * document without any recognised field both carry null parsed values.
 */
@Getter
@Builder
public class DocumentResponse {
    private final Long id;
    private final String filename;
    private final String rawText;
    private final ParsedResult parsed;
    private final String jobId;
    private final DocumentStatus status;
    private final String errorMessage;
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;

    public static DocumentResponse from(final FinancialDocument document) {
        return DocumentResponse.builder()
                               .id(document.getId())
                               .filename(document.getFilename())
                               .rawText(document.getRawText())
                               .parsed(ParsedResult.from(document.getParsedFields()))
                               .jobId(document.getJobId())
                               .status(document.getStatus())
                               .errorMessage(document.getErrorMessage())
                               .createdAt(document.getCreatedAt())
                               .updatedAt(document.getUpdatedAt())
                               .build();
    }
}
