package com.agentsearch.dto.request;

import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.dto.internal.ConversationTurn;
import com.agentsearch.dto.internal.SearchStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSearchRequest {

    // ================= CORE QUERY =================
    @NotBlank(message = "Query cannot be blank")
    private String query;

    /**
     * Prior conversation turns, oldest first
     */
    @Valid
    @Builder.Default
    private List<ConversationTurn> history = new ArrayList<>();

    // ================= PIPELINE OPTIONS =================
    @Builder.Default
    private BackendType backend = BackendType.DOCUMENT;

    @Builder.Default
    private SearchStrategy strategy = SearchStrategy.BLIND;

    /**
     * Collection to search; required for the document backend
     */
    private String collectionId;

    /**
     * Results per subquery; the configured default is used when absent
     */
    @Min(value = 1, message = "maxResults must be at least 1")
    @Max(value = 25, message = "maxResults cannot exceed 25")
    private Integer maxResults;
}
