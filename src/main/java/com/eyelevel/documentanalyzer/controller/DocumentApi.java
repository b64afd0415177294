package com.eyelevel.documentanalyzer.controller;

import com.eyelevel.documentanalyzer.dto.common.ApiResponse;
import com.eyelevel.documentanalyzer.dto.document.DocumentResponse;
import com.eyelevel.documentanalyzer.dto.job.JobStatusResponse;
import com.eyelevel.documentanalyzer.dto.upload.UploadResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Tag(name = "Document Analysis", description = "Endpoints for uploading financial documents and reading their extracted fields.")
public interface DocumentApi {

    @Operation(summary = "Upload Document",
            description = "Stores the uploaded text document, creates a PENDING record and queues it for field extraction.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Document accepted for processing.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "displayMessage": "Document accepted for processing.",
                                        "response": {
                                            "jobId": "3f1c2a9e-6b1d-4c55-9a53-0f2f7f6f8a10",
                                            "documentId": 1
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing or empty file.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "413", description = "File exceeds the configured upload limit.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "500", description = "Internal Server Error",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<UploadResponse>> upload(
            @Parameter(description = "The text document to analyze.", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Optional free-form metadata. It is logged but not stored.")
            @RequestParam(value = "metadata", required = false) String metadata);

    @Operation(summary = "Get Job Status",
            description = "Returns the state of a processing job. Parsed fields are included once the job has SUCCEEDED.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job status retrieved successfully.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Succeeded", value = """
                                    {
                                        "displayMessage": "Job status retrieved successfully.",
                                        "response": {
                                            "jobId": "3f1c2a9e-6b1d-4c55-9a53-0f2f7f6f8a10",
                                            "documentId": 1,
                                            "state": "SUCCEEDED",
                                            "result": {
                                                "vendor": "Acme Supplies Pvt Ltd",
                                                "invoiceNo": "INV-2025-001",
                                                "date": "2025-08-01",
                                                "total": "12345.67"
                                            }
                                        },
                                        "showMessage": false,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Unknown job ID.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> getJobStatus(
            @Parameter(description = "The job ID returned by the upload.", required = true)
            @PathVariable("jobId") String jobId);

    @Operation(summary = "Get Document", description = "Returns a single document with its status and parsed fields.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Document retrieved successfully.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Document not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<DocumentResponse>> getDocument(
            @Parameter(description = "The document ID.", required = true, example = "1")
            @PathVariable("id") Long id);

    @Operation(summary = "List Documents", description = "Lists documents in ID order using offset pagination.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Documents retrieved successfully.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid paging parameters.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<List<DocumentResponse>>> listDocuments(
            @Parameter(description = "Number of documents to skip.", example = "0")
            @RequestParam(value = "skip", defaultValue = "0") int skip,
            @Parameter(description = "Maximum number of documents to return. Capped by the server.", example = "50")
            @RequestParam(value = "limit", required = false) Integer limit);
}
