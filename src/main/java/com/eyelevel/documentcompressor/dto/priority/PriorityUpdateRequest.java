package com.eyelevel.documentcompressor.dto.priority;

import com.eyelevel.documentcompressor.model.JobPriority;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Schema(description = "Changes the priority of the queued compression jobs of one or more documents.")
public class PriorityUpdateRequest {

    @NotEmpty(message = "At least one document id must be provided.")
    @Size(max = 1000, message = "At most 1000 document ids can be updated at once.")
    @Schema(description = "Documents whose queued jobs should be re-prioritized.")
    private List<@NotNull UUID> documentIds;

    @NotNull(message = "The 'priority' is required.")
    @Schema(description = "The new priority.", example = "HIGH")
    private JobPriority priority;
}
