package com.agentsearch.dto.internal;

import lombok.Builder;
import lombok.Value;

/**
 * A scored, attributed snippet of retrieved evidence.
 * The relevance score is clamped into [0, 1] on construction.
 */
@Value
public class Context {

    String sourceId;

    String title;

    String content;

    double relevanceScore;

    SourceType sourceType;

    String url;  // web and deep_web only

    String subquery;  // owning subquery, set by the fan-out

    @Builder(toBuilder = true)
    public Context(String sourceId,
                   String title,
                   String content,
                   Double relevanceScore,
                   SourceType sourceType,
                   String url,
                   String subquery) {
        this.sourceId = sourceId;
        this.title = title != null ? title : "Unknown";
        this.content = content != null ? content : "";
        this.relevanceScore = clampScore(relevanceScore);
        this.sourceType = sourceType;
        this.url = url;
        this.subquery = subquery;
    }

    static double clampScore(Double score) {
        if (score == null || score.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
