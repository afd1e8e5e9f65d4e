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
import com.eyelevel.documentcompressor.exception.DocumentValidationException;
import com.eyelevel.documentcompressor.model.CompressionJob;
import com.eyelevel.documentcompressor.model.JobPriority;
import com.eyelevel.documentcompressor.model.JobStatus;
import com.eyelevel.documentcompressor.service.ingestion.DocumentIngestionService;
import com.eyelevel.documentcompressor.service.queue.CompressionQueue;
import com.eyelevel.documentcompressor.service.stats.CompressionStatsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for document ingestion, status polling, queue priorities and compression statistics.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/compression")
@RequiredArgsConstructor
@Validated
public class CompressionController implements CompressionApi {

    private final DocumentIngestionService documentIngestionService;
    private final CompressionQueue compressionQueue;
    private final CompressionStatsService compressionStatsService;

    // --- 1. DOCUMENT ENDPOINTS ---

    @Override
    @PostMapping("/v1/documents")
    public ResponseEntity<ApiResponse<IngestionResponse>> registerDocument(
            @Valid @RequestBody final DocumentRegistrationRequest request) {
        log.info("Registering document '{}' of type '{}' ({} bytes).", request.getOriginalFilename(),
                request.getTypeId(), request.getSizeBytes());
        IngestionResponse responseData = documentIngestionService.ingest(request);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Document registered and queued for compression."));
    }

    @Override
    @GetMapping("/v1/documents/{documentId}/status")
    public ResponseEntity<ApiResponse<DocumentStatusView>> getDocumentStatus(@PathVariable final UUID documentId) {
        DocumentStatusView responseData = compressionStatsService.documentStatus(documentId);
        return ResponseEntity.ok(ApiResponse.success(responseData, "Document status retrieved successfully."));
    }

    @Override
    @PostMapping("/v1/documents/{documentId}/enqueue")
    public ResponseEntity<ApiResponse<QueueJobView>> enqueueDocument(
            @PathVariable final UUID documentId,
            @RequestParam(value = "priority", required = false) final String priority) {
        log.info("Re-queueing document {} with priority {}.", documentId, priority);
        CompressionJob job = compressionQueue.enqueue(documentId, parsePriority(priority));
        QueueJobView responseData = new QueueJobView(job.getId(), job.getDocumentId(), job.getPriority(),
                job.getStatus(), job.getAttempts(), job.getQueuedAt(), job.getAvailableAt(), job.getStartedAt(),
                job.getCompletedAt(), job.getErrorMessage());
        return ResponseEntity.ok(ApiResponse.success(responseData, "Document queued for compression."));
    }

    @Override
    @PutMapping("/v1/priority")
    public ResponseEntity<ApiResponse<PriorityUpdateResponse>> updatePriority(
            @Valid @RequestBody final PriorityUpdateRequest request) {
        int updated = request.getDocumentIds().size() == 1
                ? compressionQueue.updatePriority(request.getDocumentIds().get(0), request.getPriority())
                : compressionQueue.bulkUpdatePriority(request.getDocumentIds(), request.getPriority());
        PriorityUpdateResponse responseData = new PriorityUpdateResponse(request.getPriority(), updated);
        return ResponseEntity.ok(ApiResponse.success(responseData,
                String.format("Priority updated on %d queued jobs.", updated)));
    }

    // --- 2. STATISTICS ENDPOINTS ---

    @Override
    @GetMapping("/v1/stats/overview")
    public ResponseEntity<ApiResponse<CompressionOverview>> getOverview() {
        return ResponseEntity.ok(ApiResponse.success(compressionStatsService.overview(),
                "Compression overview retrieved successfully."));
    }

    @Override
    @GetMapping("/v1/stats/types")
    public ResponseEntity<ApiResponse<List<TypeAnalysis>>> getTypeAnalysis() {
        return ResponseEntity.ok(ApiResponse.success(compressionStatsService.perTypeAnalysis(),
                "Per-type analysis retrieved successfully."));
    }

    @Override
    @GetMapping("/v1/stats/queue")
    public ResponseEntity<ApiResponse<List<QueueJobView>>> getQueueSnapshot(
            @RequestParam(value = "limit", defaultValue = "50") final int limit) {
        return ResponseEntity.ok(ApiResponse.success(compressionStatsService.queueSnapshot(limit),
                "Queue snapshot retrieved successfully."));
    }

    @Override
    @GetMapping("/v1/stats/queue/status")
    public ResponseEntity<ApiResponse<Map<JobStatus, Long>>> getQueueStatus() {
        return ResponseEntity.ok(ApiResponse.success(compressionStatsService.queueStatus(),
                "Queue status retrieved successfully."));
    }

    @Override
    @GetMapping("/v1/stats/failed")
    public ResponseEntity<ApiResponse<List<DocumentAuditView>>> getFailedDocuments() {
        return ResponseEntity.ok(ApiResponse.success(compressionStatsService.failedDocuments(),
                "Failed documents retrieved successfully."));
    }

    @Override
    @GetMapping("/v1/stats/completed")
    public ResponseEntity<ApiResponse<List<DocumentAuditView>>> getCompletedDocuments() {
        return ResponseEntity.ok(ApiResponse.success(compressionStatsService.completedDocuments(),
                "Completed documents retrieved successfully."));
    }

    private JobPriority parsePriority(final String priority) {
        if (!StringUtils.hasText(priority)) {
            return null;
        }
        try {
            return JobPriority.fromCode(priority);
        } catch (IllegalArgumentException e) {
            throw new DocumentValidationException("Invalid priority '" + priority + "'. Expected LOW, NORMAL or HIGH.");
        }
    }
}
