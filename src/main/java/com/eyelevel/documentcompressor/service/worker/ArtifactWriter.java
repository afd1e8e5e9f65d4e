package com.eyelevel.documentcompressor.service.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Writes compressed artifacts so that they only appear at their final path once fully written and synced.
 */
@Slf4j
@Component
public class ArtifactWriter {

    /**
     * Writes {@code content} to a temporary file next to {@code target}, forces it to disk and then moves it into
     * place, replacing any previous artifact.
     *
     * @return The final path.
     */
    public Path write(Path target, byte[] content) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + target.getFileName(), ".part");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for '{}'. Falling back to a replacing move.", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        log.debug("Wrote {} bytes to '{}'.", content.length, target);
        return target;
    }

    /**
     * Removes an artifact whose commit did not go through.
     */
    public void discard(Path artifact) {
        try {
            if (Files.deleteIfExists(artifact)) {
                log.info("Discarded uncommitted artifact '{}'.", artifact);
            }
        } catch (IOException e) {
            log.error("Failed to discard uncommitted artifact '{}'. It must be removed manually.", artifact, e);
        }
    }
}
