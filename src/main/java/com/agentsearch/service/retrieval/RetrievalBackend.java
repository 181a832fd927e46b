package com.agentsearch.service.retrieval;

import com.agentsearch.dto.internal.BackendType;
import com.agentsearch.dto.internal.RetrievalResult;

/**
 * Retrieval capability behind the fan-out: one call per subquery.
 * <p>
 * Implementations never throw across this boundary. A failed search comes back
 * as a {@link RetrievalResult} with no contexts and an answer explaining what
 * went wrong.
 */
public interface RetrievalBackend {

    RetrievalResult retrieve(String subquery, int maxResults);

    BackendType type();
}
