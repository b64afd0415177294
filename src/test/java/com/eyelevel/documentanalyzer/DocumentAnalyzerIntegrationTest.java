package com.eyelevel.documentanalyzer;

import com.eyelevel.documentanalyzer.dto.job.JobStatusResponse;
import com.eyelevel.documentanalyzer.dto.upload.UploadResponse;
import com.eyelevel.documentanalyzer.model.DocumentStatus;
import com.eyelevel.documentanalyzer.model.FinancialDocument;
import com.eyelevel.documentanalyzer.model.JobState;
import com.eyelevel.documentanalyzer.repository.FinancialDocumentRepository;
import com.eyelevel.documentanalyzer.service.document.DocumentIngestionService;
import com.eyelevel.documentanalyzer.service.document.DocumentRecordService;
import com.eyelevel.documentanalyzer.service.job.JobDispatchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs uploads through the whole pipeline: storage, record creation, local dispatch,
 * extraction and the terminal status writes, against an in-memory database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Document Analyzer End-to-End Tests")
class DocumentAnalyzerIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DocumentIngestionService documentIngestionService;

    @Autowired
    private DocumentRecordService documentRecordService;

    @Autowired
    private JobDispatchService jobDispatchService;

    @Autowired
    private FinancialDocumentRepository documentRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private JobStatusResponse awaitFinished(String jobId) {
        return await().atMost(TIMEOUT)
                      .until(() -> jobDispatchService.getJobStatus(jobId), status -> status.getState().isFinished());
    }

    @Test
    @DisplayName("Should extract fields from an uploaded invoice")
    void shouldExtractFieldsFromUploadedInvoice() throws Exception {
        // Given
        byte[] content = "Vendor: Acme Ltd\nInvoice No.: INV-900\nDate: 2024-04-05\nTotal: $2,000.00\n"
                .getBytes(StandardCharsets.UTF_8);

        // When
        mockMvc.perform(multipart("/api/v1/upload")
                                .file(new MockMultipartFile("file", "acme.txt", "text/plain", content)))
               .andExpect(status().isAccepted());
        FinancialDocument uploaded = documentRepository.findAll().stream()
                                                       .filter(document -> "acme.txt".equals(document.getFilename()))
                                                       .findFirst()
                                                       .orElseThrow();

        // Then
        JobStatusResponse status = awaitFinished(uploaded.getJobId());
        assertThat(status.getState()).isEqualTo(JobState.SUCCEEDED);
        assertThat(status.getResult().getVendor()).isEqualTo("Acme Ltd");
        assertThat(status.getResult().getTotal()).isEqualTo("2000.00");

        mockMvc.perform(get("/api/v1/documents/{id}", uploaded.getId()))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.status").value("SUCCESS"))
               .andExpect(jsonPath("$.response.parsed.vendor").value("Acme Ltd"))
               .andExpect(jsonPath("$.response.parsed.invoiceNo").value("INV-900"))
               .andExpect(jsonPath("$.response.parsed.date").value("2024-04-05"))
               .andExpect(jsonPath("$.response.parsed.total").value("2000.00"))
               .andExpect(jsonPath("$.response.rawText").value(new String(content, StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should reject an empty upload without creating a document")
    void shouldRejectEmptyUpload() throws Exception {
        long before = documentRepository.count();

        mockMvc.perform(multipart("/api/v1/upload")
                                .file(new MockMultipartFile("file", "empty.txt", "text/plain", new byte[0])))
               .andExpect(status().isBadRequest());

        assertThat(documentRepository.count()).isEqualTo(before);
    }

    @Test
    @DisplayName("Should fail the document and the job when the stored file has gone")
    void shouldFailWhenFileIsMissing() {
        // Given
        String jobId = transactionTemplate.execute(tx -> {
            FinancialDocument document = documentRecordService.createRecord("ghost.txt");
            String id = jobDispatchService.submit(document.getId(), "/definitely/not/here/ghost.txt");
            documentRecordService.assignJobId(document.getId(), id);
            return id;
        });

        // When
        JobStatusResponse status = awaitFinished(jobId);

        // Then
        assertThat(status.getState()).isEqualTo(JobState.FAILED);
        assertThat(status.getError()).isEqualTo("File not found: /definitely/not/here/ghost.txt");
        FinancialDocument document = documentRepository.findById(status.getDocumentId()).orElseThrow();
        assertThat(document.getStatus()).isEqualTo(DocumentStatus.FAILED);
        assertThat(document.getRawText()).isEmpty();
        assertThat(document.getParsedFields().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should keep each document's fields intact when many are processed concurrently")
    void shouldProcessDistinctDocumentsConcurrently() throws Exception {
        // Given
        int uploads = 12;
        ExecutorService clients = Executors.newFixedThreadPool(4);
        List<Future<UploadResponse>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < uploads; i++) {
                String text = "Vendor: Vendor " + i + "\nInvoice No.: INV-" + i + "\nTotal: $" + i + ".00\n";
                byte[] content = text.getBytes(StandardCharsets.UTF_8);
                String filename = "concurrent-" + i + ".txt";
                Callable<UploadResponse> upload = () -> documentIngestionService.ingest(filename, content);
                futures.add(clients.submit(upload));
            }

            // When
            List<UploadResponse> responses = new ArrayList<>();
            for (Future<UploadResponse> future : futures) {
                responses.add(future.get());
            }

            // Then
            for (UploadResponse response : responses) {
                assertThat(awaitFinished(response.getJobId()).getState()).isEqualTo(JobState.SUCCEEDED);
                FinancialDocument document = documentRepository.findById(response.getDocumentId()).orElseThrow();
                String index = document.getFilename().replace("concurrent-", "").replace(".txt", "");
                assertThat(document.getStatus()).isEqualTo(DocumentStatus.SUCCESS);
                assertThat(document.getParsedFields().getVendor()).isEqualTo("Vendor " + index);
                assertThat(document.getParsedFields().getInvoiceNo()).isEqualTo("INV-" + index);
                assertThat(document.getParsedFields().getTotal()).isEqualTo(index + ".00");
                assertThat(document.getJobId()).isEqualTo(response.getJobId());
            }
        } finally {
            clients.shutdownNow();
        }
    }
}
