package com.eyelevel.documentcompressor.service.policy;

import com.eyelevel.documentcompressor.config.CompressionProperties;
import com.eyelevel.documentcompressor.dto.type.DocumentTypeRequest;
import com.eyelevel.documentcompressor.exception.DocumentValidationException;
import com.eyelevel.documentcompressor.exception.UnknownDocumentTypeException;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import com.eyelevel.documentcompressor.model.DocumentType;
import com.eyelevel.documentcompressor.model.JobPriority;
import com.eyelevel.documentcompressor.model.MediaDocument;
import com.eyelevel.documentcompressor.repository.DocumentTypeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Resolves the compression policy of a document type and decides, per document, whether and how to compress it.
 * Policies are cached and evicted when a type is changed through this registry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyRegistry {

    public static final String POLICY_CACHE = "compressionPolicies";

    static final String REASON_DISABLED = "compression disabled for document type";
    static final String REASON_BELOW_THRESHOLD = "below minimum size threshold";
    static final String REASON_UNSUPPORTED_TYPE = "unsupported MIME type for compression method";

    private final DocumentTypeRepository documentTypeRepository;
    private final CompressionProperties properties;

    /**
     * @throws UnknownDocumentTypeException if no type with this id is registered.
     */
    @Cacheable(cacheNames = POLICY_CACHE, key = "#typeId")
    @Transactional(readOnly = true)
    public CompressionPolicy lookup(final String typeId) {
        log.debug("Loading compression policy for type '{}'.", typeId);
        return documentTypeRepository.findById(typeId)
                .map(CompressionPolicy::from)
                .orElseThrow(() -> new UnknownDocumentTypeException(typeId));
    }

    public CompressionDecision decide(final MediaDocument document, final CompressionPolicy policy) {
        if (policy.method() == CompressionMethod.NONE) {
            return CompressionDecision.skip(REASON_DISABLED);
        }
        if (document.getSizeBytes() < policy.minSizeForCompression()) {
            return CompressionDecision.skip(REASON_BELOW_THRESHOLD + " (" + document.getSizeBytes() + " < "
                    + policy.minSizeForCompression() + " bytes)");
        }
        if (!isCompressible(policy.method(), document.getMimeType())) {
            return CompressionDecision.skip(REASON_UNSUPPORTED_TYPE + " (" + document.getMimeType() + " for "
                    + policy.method().getCode() + ")");
        }
        return CompressionDecision.compress(policy.method(), policy.level());
    }

    /**
     * Checks the MIME type against the configured set of the method. Entries ending in {@code /*} match a whole
     * top-level type. A method with no configured set accepts every MIME type.
     */
    public boolean isCompressible(final CompressionMethod method, final String mimeType) {
        final Set<String> allowed = properties.getCompressibleMimeTypes().get(method.getCode());
        if (allowed == null) {
            return true;
        }
        if (mimeType == null) {
            return false;
        }
        final String normalized = mimeType.trim().toLowerCase(Locale.ROOT);
        for (final String entry : allowed) {
            final String pattern = entry.trim().toLowerCase(Locale.ROOT);
            if (pattern.equals(normalized) || pattern.equals("*/*")) {
                return true;
            }
            if (pattern.endsWith("/*") && normalized.startsWith(pattern.substring(0, pattern.length() - 1))) {
                return true;
            }
        }
        return false;
    }

    @Transactional
    public DocumentType registerType(final DocumentTypeRequest request) {
        validatePolicy(request);
        if (documentTypeRepository.existsById(request.getId())) {
            throw new DocumentValidationException("Document type '" + request.getId() + "' is already registered.");
        }
        final DocumentType type = DocumentType.builder()
                .id(request.getId())
                .name(request.getName())
                .compressionMethod(request.getCompressionMethod())
                .compressionLevel(request.getCompressionLevel())
                .minSizeForCompression(request.getMinSizeForCompression())
                .defaultPriority(request.getDefaultPriority() == null ? JobPriority.NORMAL : request.getDefaultPriority())
                .description(request.getDescription())
                .build();
        final DocumentType saved = documentTypeRepository.save(type);
        log.info("Registered document type '{}' ({} level {}, min size {} bytes).", saved.getId(),
                saved.getCompressionMethod(), saved.getCompressionLevel(), saved.getMinSizeForCompression());
        return saved;
    }

    /**
     * Replaces the policy of an existing type. The id in the request is ignored in favour of {@code typeId}.
     */
    @CacheEvict(cacheNames = POLICY_CACHE, key = "#typeId")
    @Transactional
    public DocumentType updateType(final String typeId, final DocumentTypeRequest request) {
        validatePolicy(request);
        final DocumentType type = documentTypeRepository.findById(typeId)
                .orElseThrow(() -> new UnknownDocumentTypeException(typeId));
        type.setName(request.getName());
        type.setCompressionMethod(request.getCompressionMethod());
        type.setCompressionLevel(request.getCompressionLevel());
        type.setMinSizeForCompression(request.getMinSizeForCompression());
        if (request.getDefaultPriority() != null) {
            type.setDefaultPriority(request.getDefaultPriority());
        }
        type.setDescription(request.getDescription());
        final DocumentType saved = documentTypeRepository.save(type);
        log.info("Updated document type '{}' ({} level {}, min size {} bytes). Cached policy evicted.", typeId,
                saved.getCompressionMethod(), saved.getCompressionLevel(), saved.getMinSizeForCompression());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<DocumentType> listTypes() {
        return documentTypeRepository.findAllByOrderByIdAsc();
    }

    private void validatePolicy(final DocumentTypeRequest request) {
        if (request.getMinSizeForCompression() == null || request.getMinSizeForCompression() < 0) {
            throw new DocumentValidationException("Minimum size for compression must be zero or more bytes.");
        }
        final CompressionMethod method = request.getCompressionMethod();
        final Integer level = request.getCompressionLevel();
        if (method == null) {
            throw new DocumentValidationException("Compression method is required.");
        }
        if (level == null || !method.acceptsLevel(level)) {
            throw new DocumentValidationException(String.format(
                    "Compression level %s is out of range for %s (allowed %d-%d).", level, method.getCode(),
                    method.getMinLevel(), method.getMaxLevel()));
        }
    }
}
