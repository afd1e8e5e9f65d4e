package com.eyelevel.documentcompressor.dto.type;

import com.eyelevel.documentcompressor.model.CompressionMethod;
import com.eyelevel.documentcompressor.model.JobPriority;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Definition of a document type and its compression policy.")
public class DocumentTypeRequest {

    @NotBlank(message = "The 'id' cannot be empty.")
    @Size(max = 64, message = "The 'id' cannot exceed 64 characters.")
    @Schema(description = "User-defined key of the type.", example = "report")
    private String id;

    @NotBlank(message = "The 'name' cannot be empty.")
    @Schema(description = "Display name.", example = "Quarterly reports")
    private String name;

    @NotNull(message = "The 'compressionMethod' is required.")
    @Schema(description = "Compression method applied to documents of this type.", example = "PDF_OPTIMIZE")
    private CompressionMethod compressionMethod;

    @NotNull(message = "The 'compressionLevel' is required.")
    @Schema(description = "0-9 for LOSSLESS and OFFICE_OPTIMIZE, 1-100 for LOSSY and PDF_OPTIMIZE.", example = "50")
    private Integer compressionLevel;

    @NotNull(message = "The 'minSizeForCompression' is required.")
    @PositiveOrZero(message = "The 'minSizeForCompression' cannot be negative.")
    @Schema(description = "Documents smaller than this many bytes are skipped.", example = "1000000")
    private Long minSizeForCompression;

    @Schema(description = "Queue priority used when a document is enqueued without one.", example = "NORMAL",
            nullable = true)
    private JobPriority defaultPriority;

    @Size(max = 1024, message = "The 'description' cannot exceed 1024 characters.")
    private String description;
}
