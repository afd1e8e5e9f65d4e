package com.eyelevel.documentcompressor.repository;

import com.eyelevel.documentcompressor.model.CompressionStatus;

/**
 * Projection of one {@code (type, status)} group of media documents.
 */
public interface DocumentStatusAggregate {

    String getTypeId();

    CompressionStatus getStatus();

    Long getDocumentCount();

    Long getOriginalBytes();

    Long getCompressedBytes();

    Long getMinOriginalBytes();

    Long getMaxOriginalBytes();
}
