package com.agentsearch.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkRequest {

    @NotNull
    private String text;

    @Min(value = 1, message = "chunkSize must be at least 1")
    @Max(value = 20000, message = "chunkSize cannot exceed 20000")
    private Integer chunkSize;

    @Min(value = 0, message = "overlap cannot be negative")
    private Integer overlap;

    private String strategy;
}
