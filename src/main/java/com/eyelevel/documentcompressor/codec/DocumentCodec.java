package com.eyelevel.documentcompressor.codec;

import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.model.CompressionMethod;

import java.nio.file.Path;

/**
 * Defines the contract for a compressor that turns an original document into the bytes of its compressed artifact.
 * <p>
 * Implementations only read the input path. They never touch the document store or the job queue, and must honour
 * thread interruption so that a timed-out invocation can be abandoned.
 */
public interface DocumentCodec {

    /**
     * Checks if this codec can apply the given method to documents of the given MIME type.
     *
     * @param method   The compression method configured for the document's type.
     * @param mimeType The document's MIME type, lower case.
     * @return {@code true} if this codec handles the combination.
     */
    boolean supports(CompressionMethod method, String mimeType);

    /**
     * Compresses the document at {@code input}.
     *
     * @param input  The original document.
     * @param method The compression method; always one this codec {@link #supports supports}.
     * @param level  The compression level, already validated against the method's range.
     * @return The complete compressed artifact.
     * @throws CodecException if the input is unsupported or corrupt, or reading it fails.
     */
    byte[] compress(Path input, CompressionMethod method, int level) throws CodecException;
}
