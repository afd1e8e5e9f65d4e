package com.eyelevel.documentcompressor.codec.impl;

import com.eyelevel.documentcompressor.codec.DocumentCodec;
import com.eyelevel.documentcompressor.exception.CodecException;
import com.eyelevel.documentcompressor.model.CompressionMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Lossy re-encoding of raster images as baseline JPEG. The level is the JPEG quality in percent.
 * Transparent pixels are flattened onto white, since JPEG carries no alpha channel.
 */
@Slf4j
@Component
@Order(10)
public class JpegImageCodec implements DocumentCodec {

    @Override
    public boolean supports(CompressionMethod method, String mimeType) {
        return method == CompressionMethod.LOSSY && mimeType != null && mimeType.startsWith("image/");
    }

    @Override
    public byte[] compress(Path input, CompressionMethod method, int level) throws CodecException {
        BufferedImage source;
        try {
            if (!Files.isRegularFile(input)) {
                throw new CodecException(CodecException.Kind.IO_ERROR, "Original file not found: " + input);
            }
            source = ImageIO.read(input.toFile());
        } catch (IOException e) {
            throw new CodecException(CodecException.Kind.CORRUPT_INPUT,
                    "Image could not be decoded: " + input.getFileName(), e);
        }
        if (source == null) {
            throw new CodecException(CodecException.Kind.UNSUPPORTED,
                    "No image reader is available for " + input.getFileName());
        }

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new CodecException(CodecException.Kind.UNSUPPORTED, "No JPEG writer is available.");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(buffer)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(level / 100f);
            writer.setOutput(out);
            writer.write(null, new IIOImage(toRgb(source), null, null), param);
        } catch (IOException e) {
            throw new CodecException(CodecException.Kind.IO_ERROR,
                    "JPEG encoding failed for " + input.getFileName() + ": " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
        log.debug("JPEG quality {} produced {} bytes for '{}'.", level, buffer.size(), input.getFileName());
        return buffer.toByteArray();
    }

    private BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, Color.WHITE, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }
}
