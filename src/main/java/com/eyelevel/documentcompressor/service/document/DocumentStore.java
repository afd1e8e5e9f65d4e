package com.eyelevel.documentcompressor.service.document;

import com.eyelevel.documentcompressor.dto.document.DocumentRegistrationRequest;
import com.eyelevel.documentcompressor.exception.DocumentNotFoundException;
import com.eyelevel.documentcompressor.exception.DocumentValidationException;
import com.eyelevel.documentcompressor.exception.UnknownDocumentTypeException;
import com.eyelevel.documentcompressor.model.CompressionStatus;
import com.eyelevel.documentcompressor.model.MediaDocument;
import com.eyelevel.documentcompressor.repository.DocumentTypeRepository;
import com.eyelevel.documentcompressor.repository.MediaDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Owns the metadata of stored media documents and their compression status.
 * <p>
 * The {@code mark*} methods are single conditional updates that write the status together with the
 * derived-artifact fields. They join the caller's transaction and report whether the transition applied, leaving
 * the decision to roll back to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentStore {

    private static final Pattern MIME_TYPE_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9!#$&^_.+-]*/[a-z0-9][a-z0-9!#$&^_.+-]*$");

    private static final Set<CompressionStatus> PROCESSABLE = EnumSet.of(CompressionStatus.PENDING,
            CompressionStatus.PROCESSING, CompressionStatus.FAILED);
    private static final Set<CompressionStatus> UNFINISHED = EnumSet.of(CompressionStatus.PENDING,
            CompressionStatus.PROCESSING);

    private final MediaDocumentRepository mediaDocumentRepository;
    private final DocumentTypeRepository documentTypeRepository;
    private final Clock clock;

    /**
     * Validates the metadata and persists a new document in {@link CompressionStatus#PENDING}.
     *
     * @throws DocumentValidationException  if the metadata is malformed.
     * @throws UnknownDocumentTypeException if the referenced type is not registered.
     */
    @Transactional
    public MediaDocument registerDocument(final DocumentRegistrationRequest request) {
        final String error = validate(request);
        if (error != null) {
            log.warn("Rejecting document registration for '{}': {}", request == null ? null : request.getOriginalFilename(), error);
            throw new DocumentValidationException(error);
        }
        if (!documentTypeRepository.existsById(request.getTypeId())) {
            throw new UnknownDocumentTypeException(request.getTypeId());
        }

        final MediaDocument document = MediaDocument.builder()
                .originalFilename(FilenameUtils.getName(request.getOriginalFilename()))
                .mimeType(request.getMimeType().trim().toLowerCase(Locale.ROOT))
                .sizeBytes(request.getSizeBytes())
                .originalPath(request.getOriginalPath())
                .typeId(request.getTypeId())
                .compressionStatus(CompressionStatus.PENDING)
                .hasError(false)
                .updatedAt(now())
                .build();
        final MediaDocument saved = mediaDocumentRepository.save(document);
        log.info("Registered document {} ('{}', {} bytes, type '{}').", saved.getId(), saved.getOriginalFilename(),
                saved.getSizeBytes(), saved.getTypeId());
        return saved;
    }

    @Transactional(readOnly = true)
    public MediaDocument getDocument(final UUID documentId) {
        return mediaDocumentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException("Document not found with ID: " + documentId));
    }

    @Transactional(readOnly = true)
    public CompressionStatus getCompressionStatus(final UUID documentId) {
        return mediaDocumentRepository.findCompressionStatusById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException("Document not found with ID: " + documentId));
    }

    /**
     * Moves a pending, processing or previously failed document to processing and clears its error fields.
     */
    @Transactional
    public boolean markProcessing(final UUID documentId) {
        return applied(mediaDocumentRepository.markProcessing(documentId, PROCESSABLE, now()),
                documentId, CompressionStatus.PROCESSING);
    }

    /**
     * Moves a processing document to completed, recording the artifact path, its size and the completion time.
     */
    @Transactional
    public boolean markCompleted(final UUID documentId, final String compressedPath, final long compressedSize) {
        return applied(mediaDocumentRepository.markCompleted(documentId, compressedPath, compressedSize,
                now()), documentId, CompressionStatus.COMPLETED);
    }

    @Transactional
    public boolean markFailed(final UUID documentId, final String errorMessage) {
        return applied(mediaDocumentRepository.markFailed(documentId, errorMessage, UNFINISHED,
                now()), documentId, CompressionStatus.FAILED);
    }

    @Transactional
    public boolean markSkipped(final UUID documentId, final String reason) {
        return applied(mediaDocumentRepository.markSkipped(documentId, reason, UNFINISHED, now()),
                documentId, CompressionStatus.SKIPPED);
    }

    private boolean applied(final int updatedRows, final UUID documentId, final CompressionStatus target) {
        if (updatedRows == 0) {
            log.warn("Document {} could not be moved to {}; it is missing or not in an expected state.", documentId,
                    target);
            return false;
        }
        log.debug("Document {} moved to {}.", documentId, target);
        return true;
    }

    private String validate(final DocumentRegistrationRequest request) {
        if (request == null) {
            return "Document metadata is required.";
        }
        final String baseName = FilenameUtils.getName(request.getOriginalFilename());
        if (!StringUtils.hasText(baseName) || baseName.trim().equals(".") || baseName.trim().equals("..")) {
            return "Document has an invalid or empty file name.";
        }
        if (!StringUtils.hasText(request.getMimeType())
                || !MIME_TYPE_PATTERN.matcher(request.getMimeType().trim().toLowerCase(Locale.ROOT)).matches()) {
            return "Document has an invalid MIME type: '" + request.getMimeType() + "'.";
        }
        if (request.getSizeBytes() == null || request.getSizeBytes() < 0) {
            return "Document size must be zero or more bytes.";
        }
        if (!StringUtils.hasText(request.getOriginalPath())) {
            return "Document original path is required.";
        }
        if (!StringUtils.hasText(request.getTypeId())) {
            return "Document type id is required.";
        }
        return null;
    }

    /**
     * Timestamps are stored as UTC wall-clock time whatever the clock's zone.
     */
    private LocalDateTime now() {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
