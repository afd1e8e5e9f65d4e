package com.eyelevel.documentcompressor.controller;

import com.eyelevel.documentcompressor.dto.common.ApiResponse;
import com.eyelevel.documentcompressor.dto.type.DocumentTypeRequest;
import com.eyelevel.documentcompressor.model.DocumentType;
import com.eyelevel.documentcompressor.service.policy.PolicyRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Administration of document types and their compression policies.
 */
@Slf4j
@RestController
@RequestMapping("/compression/v1/types")
@RequiredArgsConstructor
@Validated
@Tag(name = "Document Types", description = "Administrative endpoints for document types and their compression policies.")
public class DocumentTypeController {

    private final PolicyRegistry policyRegistry;

    @GetMapping
    @Operation(summary = "List Document Types")
    public ResponseEntity<ApiResponse<List<DocumentType>>> listTypes() {
        return ResponseEntity.ok(ApiResponse.success(policyRegistry.listTypes(),
                "Document types retrieved successfully."));
    }

    @PostMapping
    @Operation(summary = "Register a Document Type",
            description = "Levels are validated against the method: 0-9 for LOSSLESS and OFFICE_OPTIMIZE, 1-100 for LOSSY and PDF_OPTIMIZE.")
    public ResponseEntity<ApiResponse<DocumentType>> registerType(@Valid @RequestBody final DocumentTypeRequest request) {
        log.info("ADMIN ACTION: Registering document type '{}'.", request.getId());
        return ResponseEntity.ok(ApiResponse.success(policyRegistry.registerType(request),
                "Document type registered successfully."));
    }

    @PutMapping("/{typeId}")
    @Operation(summary = "Update a Document Type", description = "Replaces the policy of a type. Jobs claimed afterwards use the new policy.")
    public ResponseEntity<ApiResponse<DocumentType>> updateType(@PathVariable final String typeId,
                                                                @Valid @RequestBody final DocumentTypeRequest request) {
        log.info("ADMIN ACTION: Updating document type '{}'.", typeId);
        return ResponseEntity.ok(ApiResponse.success(policyRegistry.updateType(typeId, request),
                "Document type updated successfully."));
    }
}
