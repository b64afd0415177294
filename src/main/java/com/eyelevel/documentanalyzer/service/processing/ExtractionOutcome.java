package com.eyelevel.documentanalyzer.service.processing;

import com.eyelevel.documentanalyzer.model.ParsedFields;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The result of one {@link DocumentProcessingService#process(Long, String)} call. It is also the
 * payload stored as a job's result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionOutcome {

    private OutcomeType type;
    private Long documentId;
    private ParsedFields fields;
    private String message;

    public static ExtractionOutcome success(final Long documentId, final ParsedFields fields) {
        return ExtractionOutcome.builder().type(OutcomeType.SUCCESS).documentId(documentId).fields(fields).build();
    }

    public static ExtractionOutcome recordNotFound(final Long documentId) {
        return ExtractionOutcome.builder().type(OutcomeType.RECORD_NOT_FOUND).documentId(documentId)
                                .message("Document not found").build();
    }

    public static ExtractionOutcome fileNotFound(final Long documentId, final String filePath) {
        return ExtractionOutcome.builder().type(OutcomeType.FILE_NOT_FOUND).documentId(documentId)
                                .message("File not found: " + filePath).build();
    }

    public static ExtractionOutcome emptyContent(final Long documentId) {
        return ExtractionOutcome.builder().type(OutcomeType.EMPTY_CONTENT).documentId(documentId)
                                .message("File is empty").build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return type == OutcomeType.SUCCESS;
    }
}
