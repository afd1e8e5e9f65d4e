package com.eyelevel.documentcompressor.service.ingestion;

import com.eyelevel.documentcompressor.dto.document.DocumentRegistrationRequest;
import com.eyelevel.documentcompressor.dto.document.IngestionResponse;
import com.eyelevel.documentcompressor.model.CompressionJob;
import com.eyelevel.documentcompressor.model.MediaDocument;
import com.eyelevel.documentcompressor.service.document.DocumentStore;
import com.eyelevel.documentcompressor.service.queue.CompressionQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for callers that create documents: registers the document and queues its first compression job
 * in one transaction, so a document never exists without its job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    private final DocumentStore documentStore;
    private final CompressionQueue compressionQueue;

    @Transactional
    public IngestionResponse ingest(final DocumentRegistrationRequest request) {
        final MediaDocument document = documentStore.registerDocument(request);
        final CompressionJob job = compressionQueue.enqueue(document.getId(), request.getPriority());
        log.info("Ingested document {} with compression Job ID {}.", document.getId(), job.getId());
        return new IngestionResponse(document.getId(), job.getId(), document.getCompressionStatus(),
                job.getPriority());
    }
}
