package com.eyelevel.documentanalyzer.controller;

import com.eyelevel.documentanalyzer.dto.common.ApiResponse;
import com.eyelevel.documentanalyzer.dto.document.DocumentResponse;
import com.eyelevel.documentanalyzer.dto.job.JobStatusResponse;
import com.eyelevel.documentanalyzer.dto.upload.UploadResponse;
import com.eyelevel.documentanalyzer.exception.FileStorageException;
import com.eyelevel.documentanalyzer.service.document.DocumentIngestionService;
import com.eyelevel.documentanalyzer.service.document.DocumentQueryService;
import com.eyelevel.documentanalyzer.service.job.JobDispatchService;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * REST controller for uploading documents and reading extraction results.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class DocumentController implements DocumentApi {

    private final DocumentIngestionService documentIngestionService;
    private final DocumentQueryService documentQueryService;
    private final JobDispatchService jobDispatchService;

    @Override
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<UploadResponse>> upload(
            @RequestPart("file") final MultipartFile file,
            @RequestParam(value = "metadata", required = false) final String metadata) {

        log.info("Received upload '{}' ({} bytes), metadata: {}", file.getOriginalFilename(), file.getSize(), metadata);

        final byte[] content;
        try {
            content = file.getBytes();
        } catch (final IOException e) {
            throw new FileStorageException("Failed to read uploaded file: " + e.getMessage(), e);
        }

        final UploadResponse responseData = documentIngestionService.ingest(file.getOriginalFilename(), content);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                             .body(ApiResponse.success(responseData, "Document accepted for processing.",
                                                       HttpStatus.ACCEPTED));
    }

    @Override
    @GetMapping("/status/{jobId}")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getJobStatus(
            @PathVariable("jobId") @NotBlank(message = "The 'jobId' cannot be empty.") final String jobId) {

        log.debug("Fetching status for job {}", jobId);
        final JobStatusResponse responseData = jobDispatchService.getJobStatus(jobId);

        final ApiResponse<JobStatusResponse> response = ApiResponse.<JobStatusResponse>builder()
                .response(responseData)
                .displayMessage("Job status retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/documents/{id}")
    public ResponseEntity<ApiResponse<DocumentResponse>> getDocument(@PathVariable("id") final Long id) {
        log.debug("Fetching Document ID: {}", id);
        final DocumentResponse responseData = documentQueryService.getDocument(id);

        final ApiResponse<DocumentResponse> response = ApiResponse.<DocumentResponse>builder()
                .response(responseData)
                .displayMessage("Document retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/documents")
    public ResponseEntity<ApiResponse<List<DocumentResponse>>> listDocuments(
            @RequestParam(value = "skip", defaultValue = "0") @Min(value = 0, message = "The 'skip' parameter cannot be negative.") final int skip,
            @RequestParam(value = "limit", required = false) @Min(value = 1, message = "The 'limit' parameter must be at least 1.") final Integer limit) {

        final List<DocumentResponse> responseData = documentQueryService.listDocuments(skip, limit);

        final ApiResponse<List<DocumentResponse>> response = ApiResponse.<List<DocumentResponse>>builder()
                .response(responseData)
                .displayMessage("Documents retrieved successfully.")
                .showMessage(false)
                .statusCode(HttpStatus.OK.value())
                .build();
        return ResponseEntity.ok(response);
    }
}
