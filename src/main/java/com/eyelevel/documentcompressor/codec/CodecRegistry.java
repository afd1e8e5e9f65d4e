package com.eyelevel.documentcompressor.codec;

import com.eyelevel.documentcompressor.model.CompressionMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * A factory for retrieving the {@link DocumentCodec} that handles a compression method and MIME type.
 * It keeps every codec bean and returns the first one that supports the combination.
 */
@Service
@Slf4j
public class CodecRegistry {

    private final List<DocumentCodec> codecs;

    public CodecRegistry(List<DocumentCodec> codecs) {
        this.codecs = codecs;
        log.info("CodecRegistry initialized with {} available codecs.", codecs.size());
    }

    public Optional<DocumentCodec> getCodec(CompressionMethod method, String mimeType) {
        Optional<DocumentCodec> codec = codecs.stream()
                .filter(c -> c.supports(method, mimeType))
                .findFirst();
        log.debug("Searching for codec for method '{}' and type '{}'. Found: {}", method, mimeType,
                codec.map(c -> c.getClass().getSimpleName()).orElse("None"));
        return codec;
    }
}
