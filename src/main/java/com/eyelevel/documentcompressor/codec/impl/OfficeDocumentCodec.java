package com.eyelevel.documentcompressor.codec.impl;

import com.eyelevel.documentcompressor.codec.DocumentCodec;
import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Rewrites Office Open XML (and OpenDocument) zip containers with every part deflated at the requested level.
 * Producers frequently store parts uncompressed or at a low level, so this often recovers a good share of the size.
 */
@Slf4j
@Component
@Order(20)
public class OfficeDocumentCodec implements DocumentCodec {

    private static final String OPEN_DOCUMENT_MIMETYPE_ENTRY = "mimetype";

    @Override
    public boolean supports(CompressionMethod method, String mimeType) {
        return method == CompressionMethod.OFFICE_OPTIMIZE;
    }

    @Override
    public byte[] compress(Path input, CompressionMethod method, int level) throws CodecException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int entries = 0;
        try (InputStream raw = Files.newInputStream(input);
             ZipInputStream zipIn = new ZipInputStream(raw);
             ZipOutputStream zipOut = new ZipOutputStream(buffer)) {
            zipOut.setLevel(level);
            ZipEntry entry;
            while ((entry = zipIn.getNextEntry()) != null) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedIOException("Office optimization interrupted for " + input.getFileName());
                }
                ZipEntry rewritten = new ZipEntry(entry.getName());
                if (entry.getLastModifiedTime() != null) {
                    rewritten.setLastModifiedTime(entry.getLastModifiedTime());
                }
                if (OPEN_DOCUMENT_MIMETYPE_ENTRY.equals(entry.getName())) {
                    // OpenDocument readers expect this entry first and stored.
                    byte[] content = zipIn.readAllBytes();
                    CRC32 crc = new CRC32();
                    crc.update(content);
                    rewritten.setMethod(ZipEntry.STORED);
                    rewritten.setSize(content.length);
                    rewritten.setCompressedSize(content.length);
                    rewritten.setCrc(crc.getValue());
                    zipOut.putNextEntry(rewritten);
                    zipOut.write(content);
                } else {
                    rewritten.setMethod(ZipEntry.DEFLATED);
                    zipOut.putNextEntry(rewritten);
                    zipIn.transferTo(zipOut);
                }
                zipOut.closeEntry();
                entries++;
            }
            if (entries == 0) {
                throw new CodecException(CodecException.Kind.CORRUPT_INPUT,
                        "Not a zip-based Office document: " + input.getFileName());
            }
        } catch (NoSuchFileException e) {
            throw new CodecException(CodecException.Kind.IO_ERROR, "Original file not found: " + input, e);
        } catch (ZipException e) {
            throw new CodecException(CodecException.Kind.CORRUPT_INPUT,
                    "Office container is corrupt: " + input.getFileName() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CodecException(CodecException.Kind.IO_ERROR,
                    "Office optimization failed for " + input.getFileName() + ": " + e.getMessage(), e);
        }
        log.debug("Re-deflated {} parts of '{}' at level {} into {} bytes.", entries, input.getFileName(), level,
                buffer.size());
        return buffer.toByteArray();
    }
}
