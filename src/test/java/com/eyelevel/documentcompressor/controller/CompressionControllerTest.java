package com.eyelevel.documentcompressor.controller;

import com.eyelevel.documentcompressor.dto.document.DocumentRegistrationRequest;
import com.eyelevel.documentcompressor.dto.document.IngestionResponse;
import com.eyelevel.documentcompressor.dto.stats.CompressionOverview;
import com.eyelevel.documentcompressor.exception.DocumentNotFoundException;
import com.eyelevel.documentcompressor.exception.DocumentValidationException;
import com.eyelevel.documentcompressor.exception.DuplicateJobException;
import com.eyelevel.documentcompressor.exception.UnknownDocumentTypeException;
import com.eyelevel.documentcompressor.model.CompressionJob;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import com.eyelevel.documentcompressor.model.CompressionStatus;
import com.eyelevel.documentcompressor.model.DocumentType;
import com.eyelevel.documentcompressor.model.JobPriority;
import com.eyelevel.documentcompressor.model.JobStatus;
import com.eyelevel.documentcompressor.service.ingestion.DocumentIngestionService;
import com.eyelevel.documentcompressor.service.policy.PolicyRegistry;
import com.eyelevel.documentcompressor.service.queue.CompressionQueue;
import com.eyelevel.documentcompressor.service.stats.CompressionStatsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {CompressionController.class, DocumentTypeController.class})
class CompressionControllerTest {

    private static final UUID DOCUMENT_ID = UUID.fromString("0b5e7a3c-6f2d-4e8a-9c1b-7d3e2f1a0b9c");

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DocumentIngestionService documentIngestionService;
    @MockBean
    private CompressionQueue compressionQueue;
    @MockBean
    private CompressionStatsService compressionStatsService;
    @MockBean
    private PolicyRegistry policyRegistry;

    @Test
    void registerDocumentReturnsTheQueuedJob() throws Exception {
        when(documentIngestionService.ingest(any()))
                .thenReturn(new IngestionResponse(DOCUMENT_ID, 17L, CompressionStatus.PENDING, JobPriority.HIGH));

        mockMvc.perform(post("/compression/v1/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.statusCode").value(200))
                .andExpect(jsonPath("$.response.documentId").value(DOCUMENT_ID.toString()))
                .andExpect(jsonPath("$.response.jobId").value(17))
                .andExpect(jsonPath("$.response.compressionStatus").value("PENDING"));
    }

    @Test
    void negativeSizeIsRejectedBeforeReachingTheService() throws Exception {
        DocumentRegistrationRequest request = validRequest();
        request.setSizeBytes(-5L);

        mockMvc.perform(post("/compression/v1/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.statusCode").value(400))
                .andExpect(jsonPath("$.error").value(containsString("sizeBytes")));
        verifyNoInteractions(documentIngestionService);
    }

    @Test
    void malformedBodyIsABadRequest() throws Exception {
        mockMvc.perform(post("/compression/v1/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalFilename\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.displayMessage").value("Malformed request body."));
    }

    @Test
    void unknownTypeIsABadRequest() throws Exception {
        when(documentIngestionService.ingest(any())).thenThrow(new UnknownDocumentTypeException("blueprint"));

        mockMvc.perform(post("/compression/v1/documents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isBadRequest());
    }

    @Test
    void statusOfUnknownDocumentIsNotFound() throws Exception {
        when(compressionStatsService.documentStatus(DOCUMENT_ID))
                .thenThrow(new DocumentNotFoundException("Document not found with ID: " + DOCUMENT_ID));

        mockMvc.perform(get("/compression/v1/documents/{id}/status", DOCUMENT_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.statusCode").value(404));
    }

    @Test
    void malformedDocumentIdIsABadRequest() throws Exception {
        mockMvc.perform(get("/compression/v1/documents/{id}/status", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.displayMessage").value("Invalid parameter type provided."));
    }

    @Test
    void duplicateEnqueueIsAConflict() throws Exception {
        when(compressionQueue.enqueue(eq(DOCUMENT_ID), isNull())).thenThrow(new DuplicateJobException(DOCUMENT_ID));

        mockMvc.perform(post("/compression/v1/documents/{id}/enqueue", DOCUMENT_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.statusCode").value(409));
    }

    @Test
    void enqueueParsesThePriority() throws Exception {
        CompressionJob job = CompressionJob.builder()
                .id(3L)
                .documentId(DOCUMENT_ID)
                .priority(JobPriority.HIGH)
                .status(JobStatus.QUEUED)
                .attempts(0)
                .queuedAt(LocalDateTime.of(2024, 5, 1, 10, 0))
                .availableAt(LocalDateTime.of(2024, 5, 1, 10, 0))
                .build();
        when(compressionQueue.enqueue(DOCUMENT_ID, JobPriority.HIGH)).thenReturn(job);

        mockMvc.perform(post("/compression/v1/documents/{id}/enqueue", DOCUMENT_ID).param("priority", "high"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.jobId").value(3))
                .andExpect(jsonPath("$.response.priority").value("HIGH"));
    }

    @Test
    void unknownPriorityIsABadRequest() throws Exception {
        mockMvc.perform(post("/compression/v1/documents/{id}/enqueue", DOCUMENT_ID).param("priority", "urgent"))
                .andExpect(status().isBadRequest());
        verify(compressionQueue, never()).enqueue(any(), any());
    }

    @Test
    void bulkPriorityUpdateReportsTheAffectedJobs() throws Exception {
        when(compressionQueue.bulkUpdatePriority(anyList(), eq(JobPriority.LOW))).thenReturn(2);

        mockMvc.perform(put("/compression/v1/priority")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "documentIds", List.of(DOCUMENT_ID, UUID.randomUUID()),
                                "priority", "LOW"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.updatedJobs").value(2));
    }

    @Test
    void emptyPriorityUpdateIsRejected() throws Exception {
        mockMvc.perform(put("/compression/v1/priority")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documentIds\": [], \"priority\": \"LOW\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void overviewIsWrapped() throws Exception {
        when(compressionStatsService.overview()).thenReturn(CompressionOverview.builder()
                .statusCounts(Map.of(CompressionStatus.COMPLETED, 1L))
                .totalDocuments(1)
                .originalBytes(2_000_000)
                .compressedBytes(500_000)
                .spaceSavedBytes(1_500_000)
                .savingsPercent(new BigDecimal("75.00"))
                .build());

        mockMvc.perform(get("/compression/v1/stats/overview"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.savingsPercent").value(75.0))
                .andExpect(jsonPath("$.response.statusCounts.COMPLETED").value(1));
    }

    @Test
    void outOfRangeSnapshotLimitIsABadRequest() throws Exception {
        when(compressionStatsService.queueSnapshot(0))
                .thenThrow(new DocumentValidationException("Queue snapshot limit must be between 1 and 500, got 0."));

        mockMvc.perform(get("/compression/v1/stats/queue").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void duplicateTypeRegistrationIsABadRequest() throws Exception {
        when(policyRegistry.registerType(any()))
                .thenThrow(new DocumentValidationException("Document type 'report' already exists."));

        mockMvc.perform(post("/compression/v1/types")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"report\", \"name\": \"Reports\", \"compressionMethod\": \"PDF_OPTIMIZE\","
                                + " \"compressionLevel\": 50, \"minSizeForCompression\": 1000000}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void typeUpdateReplacesThePolicyOfThePathType() throws Exception {
        when(policyRegistry.updateType(eq("report"), any())).thenReturn(DocumentType.builder()
                .id("report")
                .name("Reports")
                .compressionMethod(CompressionMethod.NONE)
                .compressionLevel(0)
                .minSizeForCompression(0L)
                .defaultPriority(JobPriority.NORMAL)
                .build());

        mockMvc.perform(put("/compression/v1/types/report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"report\", \"name\": \"Reports\", \"compressionMethod\": \"NONE\","
                                + " \"compressionLevel\": 0, \"minSizeForCompression\": 0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.id").value("report"))
                .andExpect(jsonPath("$.response.compressionMethod").value("NONE"));

        verify(policyRegistry).updateType(eq("report"), any());
    }

    @Test
    void updateOfUnknownTypeIsABadRequest() throws Exception {
        when(policyRegistry.updateType(eq("blueprint"), any())).thenThrow(new UnknownDocumentTypeException("blueprint"));

        mockMvc.perform(put("/compression/v1/types/blueprint")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"blueprint\", \"name\": \"Blueprints\", \"compressionMethod\": \"LOSSLESS\","
                                + " \"compressionLevel\": 6, \"minSizeForCompression\": 0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void getOnAPostEndpointIsNotAllowed() throws Exception {
        mockMvc.perform(get("/compression/v1/documents"))
                .andExpect(status().isMethodNotAllowed());
    }

    private static DocumentRegistrationRequest validRequest() {
        return DocumentRegistrationRequest.builder()
                .originalFilename("quarterly-report.pdf")
                .mimeType("application/pdf")
                .sizeBytes(2_000_000L)
                .originalPath("/data/originals/quarterly-report.pdf")
                .typeId("report")
                .build();
    }
}
