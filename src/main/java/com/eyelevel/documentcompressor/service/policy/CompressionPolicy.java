package com.eyelevel.documentcompressor.service.policy;

import com.eyelevel.documentcompressor.model.CompressionMethod;
import com.eyelevel.documentcompressor.model.DocumentType;
import com.eyelevel.documentcompressor.model.JobPriority;

/**
 * An immutable snapshot of a document type's compression configuration.
 */
public record CompressionPolicy(String typeId,
                                String name,
                                CompressionMethod method,
                                int level,
                                long minSizeForCompression,
                                JobPriority defaultPriority) {

    public static CompressionPolicy from(DocumentType type) {
        return new CompressionPolicy(type.getId(), type.getName(), type.getCompressionMethod(),
                type.getCompressionLevel(), type.getMinSizeForCompression(),
                type.getDefaultPriority() == null ? JobPriority.NORMAL : type.getDefaultPriority());
    }
}
