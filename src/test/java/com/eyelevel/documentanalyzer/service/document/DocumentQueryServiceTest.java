package com.eyelevel.documentanalyzer.service.document;

import com.eyelevel.documentanalyzer.config.DocumentProcessingConfig;
import com.eyelevel.documentanalyzer.dto.document.DocumentResponse;
import com.eyelevel.documentanalyzer.exception.DocumentNotFoundException;
import com.eyelevel.documentanalyzer.model.DocumentStatus;
import com.eyelevel.documentanalyzer.model.FinancialDocument;
import com.eyelevel.documentanalyzer.model.ParsedFields;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentQueryService Unit Tests")
class DocumentQueryServiceTest {

    @Mock
    private DocumentRecordService documentRecordService;

    private DocumentQueryService documentQueryService;

    @BeforeEach
    void setUp() {
        DocumentProcessingConfig config = new DocumentProcessingConfig();
        config.getQuery().setDefaultLimit(50);
        config.getQuery().setMaxLimit(200);
        documentQueryService = new DocumentQueryService(documentRecordService, config);
    }

    @Test
    @DisplayName("Should map a stored document to its read model")
    void shouldReturnDocument() {
        // Given
        FinancialDocument document = FinancialDocument.builder()
                                                      .id(1L)
                                                      .filename("invoice.txt")
                                                      .rawText("Vendor: Acme Ltd")
                                                      .parsedFields(ParsedFields.builder().vendor("Acme Ltd").build())
                                                      .status(DocumentStatus.SUCCESS)
                                                      .jobId("job-1")
                                                      .build();
        when(documentRecordService.getRecord(1L)).thenReturn(Optional.of(document));

        // When
        DocumentResponse response = documentQueryService.getDocument(1L);

        // Then
        assertThat(response.getId()).isEqualTo(1L);
        assertThat(response.getStatus()).isEqualTo(DocumentStatus.SUCCESS);
        assertThat(response.getParsed().getVendor()).isEqualTo("Acme Ltd");
        assertThat(response.getParsed().getTotal()).isNull();
        assertThat(response.getJobId()).isEqualTo("job-1");
    }

    @Test
    @DisplayName("Should throw for a missing document")
    void shouldThrowForMissingDocument() {
        when(documentRecordService.getRecord(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> documentQueryService.getDocument(99L))
                .isInstanceOf(DocumentNotFoundException.class)
                .hasMessage("Document not found with ID: 99");
    }

    @Test
    @DisplayName("Should cap the page size at the configured maximum")
    void shouldClampLimit() {
        when(documentRecordService.listRecords(10, 200)).thenReturn(List.of());

        documentQueryService.listDocuments(10, 5000);

        verify(documentRecordService).listRecords(10, 200);
    }

    @Test
    @DisplayName("Should use the default page size when no limit is given")
    void shouldUseDefaultLimit() {
        when(documentRecordService.listRecords(0, 50)).thenReturn(List.of(
                FinancialDocument.builder().id(1L).status(DocumentStatus.PENDING).build()));

        List<DocumentResponse> documents = documentQueryService.listDocuments(0, null);

        assertThat(documents).extracting(DocumentResponse::getId).containsExactly(1L);
    }
}
