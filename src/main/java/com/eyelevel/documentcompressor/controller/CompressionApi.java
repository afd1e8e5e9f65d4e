package com.eyelevel.documentcompressor.controller;

import com.eyelevel.documentcompressor.dto.common.ApiResponse;
import com.eyelevel.documentcompressor.dto.document.DocumentAuditView;
import com.eyelevel.documentcompressor.dto.document.DocumentRegistrationRequest;
import com.eyelevel.documentcompressor.dto.document.DocumentStatusView;
import com.eyelevel.documentcompressor.dto.document.IngestionResponse;
import com.eyelevel.documentcompressor.dto.priority.PriorityUpdateRequest;
import com.eyelevel.documentcompressor.dto.priority.PriorityUpdateResponse;
import com.eyelevel.documentcompressor.dto.stats.CompressionOverview;
import com.eyelevel.documentcompressor.dto.stats.QueueJobView;
import com.eyelevel.documentcompressor.dto.stats.TypeAnalysis;
import com.eyelevel.documentcompressor.model.JobStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Tag(name = "Document Compression", description = "Endpoints for queueing documents for compression and monitoring the compression pipeline.")
public interface CompressionApi {

    @Operation(summary = "Register a Document for Compression",
            description = "Registers the metadata of an already stored document and queues its compression job. The document starts in PENDING.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Document registered and queued.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Document registered and queued for compression.",
                                        "response": {
                                            "documentId": "3f1c6d2e-8a44-4c4b-9a43-2f0d1f6d9b10",
                                            "jobId": 42,
                                            "compressionStatus": "PENDING",
                                            "priority": "NORMAL"
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid metadata or unknown document type.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<IngestionResponse>> registerDocument(@Valid @RequestBody DocumentRegistrationRequest request);

    @Operation(summary = "Get Document Compression Status",
            description = "Returns the document's compression status, its artifact if completed, and its most recent job.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status retrieved."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No such document.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<DocumentStatusView>> getDocumentStatus(
            @Parameter(description = "The document ID.", required = true) @PathVariable UUID documentId);

    @Operation(summary = "Re-queue a Document",
            description = "Queues a new compression job for a PENDING or FAILED document that has no active job.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job queued."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No such document."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The document already has an active job or is finished.")
    })
    ResponseEntity<ApiResponse<QueueJobView>> enqueueDocument(
            @Parameter(description = "The document ID.", required = true) @PathVariable UUID documentId,
            @Parameter(description = "Optional priority; defaults to the document type's priority.", example = "HIGH")
            @RequestParam(value = "priority", required = false) String priority);

    @Operation(summary = "Update Job Priorities",
            description = "Sets the priority of the queued jobs of the given documents. Running and finished jobs are left unchanged.")
    ResponseEntity<ApiResponse<PriorityUpdateResponse>> updatePriority(@Valid @RequestBody PriorityUpdateRequest request);

    @Operation(summary = "Compression Overview", description = "Per-status document counts, byte totals and overall space savings.")
    ResponseEntity<ApiResponse<CompressionOverview>> getOverview();

    @Operation(summary = "Per-Type Analysis", description = "Document counts and size statistics for every document type.")
    ResponseEntity<ApiResponse<List<TypeAnalysis>>> getTypeAnalysis();

    @Operation(summary = "Queue Snapshot", description = "The most recently queued jobs, newest first.")
    ResponseEntity<ApiResponse<List<QueueJobView>>> getQueueSnapshot(
            @Parameter(description = "Number of jobs to return (1-500).", example = "50")
            @RequestParam(value = "limit", defaultValue = "50") int limit);

    @Operation(summary = "Queue Status", description = "The number of compression jobs in each status.")
    ResponseEntity<ApiResponse<Map<JobStatus, Long>>> getQueueStatus();

    @Operation(summary = "Failed Documents", description = "Audit listing of documents whose compression failed.")
    ResponseEntity<ApiResponse<List<DocumentAuditView>>> getFailedDocuments();

    @Operation(summary = "Completed Documents", description = "Audit listing of documents with a compressed artifact.")
    ResponseEntity<ApiResponse<List<DocumentAuditView>>> getCompletedDocuments();
}
