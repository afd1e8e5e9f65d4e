package com.eyelevel.documentcompressor.dto.document;

import com.eyelevel.documentcompressor.model.JobPriority;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Metadata of a stored document to register and queue for compression.")
public class DocumentRegistrationRequest {

    @NotBlank(message = "The 'originalFilename' cannot be empty.")
    @Schema(description = "The document's original file name.", example = "quarterly-report.pdf")
    private String originalFilename;

    @NotBlank(message = "The 'mimeType' cannot be empty.")
    @Schema(description = "The document's MIME type.", example = "application/pdf")
    private String mimeType;

    @NotNull(message = "The 'sizeBytes' is required.")
    @PositiveOrZero(message = "The 'sizeBytes' cannot be negative.")
    @Schema(description = "Size of the original document in bytes.", example = "2000000")
    private Long sizeBytes;

    @NotBlank(message = "The 'originalPath' cannot be empty.")
    @Schema(description = "Where the original document is stored.", example = "/data/originals/quarterly-report.pdf")
    private String originalPath;

    @NotBlank(message = "The 'typeId' cannot be empty.")
    @Schema(description = "The registered document type whose compression policy applies.", example = "report")
    private String typeId;

    @Schema(description = "Queue priority. Defaults to the document type's default priority.", example = "HIGH",
            nullable = true)
    private JobPriority priority;
}
