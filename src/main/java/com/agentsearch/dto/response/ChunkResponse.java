package com.agentsearch.dto.response;

import com.agentsearch.dto.internal.Chunk;
import com.agentsearch.dto.internal.ChunkingStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

    private ChunkingStrategy strategy;

    private Integer chunkSize;

    private Integer overlap;

    private Integer totalChunks;

    private List<Chunk> chunks;
}
