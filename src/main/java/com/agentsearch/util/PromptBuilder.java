package com.agentsearch.util;

import java.util.List;

import org.springframework.stereotype.Component;

import com.agentsearch.dto.internal.IntermediateResult;
import com.agentsearch.dto.internal.PageContent;
import com.agentsearch.dto.internal.SearchResult;

@Component
public class PromptBuilder {

    /* =========================================================
     * BLIND DECOMPOSITION
     * ========================================================= */
    public String buildDecompositionPrompt(String query, boolean webOriented) {
        if (webOriented) {
            return """
                    You are an expert at turning complex questions into effective web search queries.

                    Original Query: %s

                    Break this query down into 2-4 focused search queries that together answer the original question.
                    Each search query should:
                    1. Be phrased to get the most relevant search engine results
                    2. Cover one particular aspect of the original query
                    3. Use short, precise keywords without filler words

                    Format your response as a bulleted list with ONLY the search queries, nothing else.
                    """.formatted(query);
        }

        return """
                You are an expert at breaking complex questions into simpler, focused subqueries.

                Original Query: %s

                Break this query down into 2-4 focused subqueries that together answer the original question.
                Each subquery should:
                1. Be self-contained and specific
                2. Cover one particular aspect of the original query
                3. Be phrased as a complete question

                Format your response as a bulleted list with ONLY the subqueries, nothing else.
                """.formatted(query);
    }

    /* =========================================================
     * INFORMED DECOMPOSITION
     * ========================================================= */
    public String buildInformedDecompositionPrompt(String query,
                                                   String initialAnswer,
                                                   String formattedContexts,
                                                   boolean webOriented) {

        String searchType = webOriented ? "web search" : "search";
        String queryType = webOriented ? "search queries" : "questions";

        StringBuilder prompt = new StringBuilder();

        prompt.append("You are an expert at breaking complex questions into effective ")
              .append(queryType).append(".\n\n");
        prompt.append("Original Query: ").append(query).append("\n\n");
        prompt.append("An initial ").append(searchType)
              .append(" has already found some information:\n\n");

        if (initialAnswer != null && !initialAnswer.isBlank()) {
            prompt.append("Initial Answer:\n").append(initialAnswer.trim()).append("\n\n");
        }

        prompt.append("Initial Results:\n").append(formattedContexts).append("\n\n");

        prompt.append("Based on what was found so far, identify 2-3 focused follow-up ")
              .append(queryType).append(" that:\n");
        prompt.append("1. Fill in important information the initial search did not cover\n");
        prompt.append("2. Explore aspects of the query that were not fully addressed\n");
        prompt.append("3. Resolve ambiguities or contradictions in the initial results\n\n");

        prompt.append("Each follow-up must:\n");
        prompt.append("- Target new information only\n");
        prompt.append("- NOT repeat what the initial results already contain\n");
        if (webOriented) {
            prompt.append("- Use short, search engine friendly keywords\n");
        } else {
            prompt.append("- Be self-contained and phrased as a complete question\n");
        }
        prompt.append("\nFormat your response as a bulleted list with ONLY the ")
              .append(queryType).append(", nothing else.");

        return prompt.toString();
    }

    /* =========================================================
     * PER-SUBQUERY ANSWERS
     * ========================================================= */
    public String buildDocumentAnswerPrompt(String subquery, List<SearchResult> hits) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("Answer the question using the document context below. ");
        prompt.append("Cite the document titles you rely on. ");
        prompt.append("If the context does not contain sufficient or relevant details, ");
        prompt.append("say that there is no relevant context instead of guessing.\n\n");

        prompt.append("Context information:\n\n");
        for (int i = 0; i < hits.size(); i++) {
            SearchResult hit = hits.get(i);
            prompt.append("[").append(i + 1).append("] From document '")
                  .append(hit.getTitle()).append("':\n")
                  .append(hit.getText()).append("\n\n");
        }

        prompt.append("Question: ").append(subquery);
        return prompt.toString();
    }

    public String buildWebAnswerPrompt(String subquery, List<SearchResult> hits) {
        StringBuilder results = new StringBuilder();
        for (int i = 0; i < hits.size(); i++) {
            SearchResult hit = hits.get(i);
            results.append("[").append(i + 1).append("] ").append(hit.getTitle()).append("\n");
            results.append("URL: ").append(hit.getUrl()).append("\n");
            results.append(hit.getText()).append("\n\n");
        }

        return """
                Based on the following web search results for the query: "%s",
                give a well-structured answer.

                Web search results:
                %s
                Your answer should:
                1. Directly address the query
                2. Combine information from several sources where available
                3. Note any conflicting information and give a balanced view
                4. Say so if the results do not fully answer the query
                """.formatted(subquery, results);
    }

    /* =========================================================
     * DEEP WEB: PAGE SUMMARY + SUBQUERY ANALYSIS
     * ========================================================= */
    public String buildPageAnalysisPrompt(String subquery, PageContent page) {
        return """
                You are a web content analyst who extracts the relevant information from noisy web pages.

                Analyze the following web page and extract what is relevant to: "%s"

                Web Page: %s
                URL: %s

                Content:
                %s

                Provide:
                1. A concise summary of the content (2-3 sentences)
                2. 3-5 key facts most relevant to the query
                3. How well this content answers the query (high/medium/low)

                Only include information present in the content.
                """.formatted(subquery, page.getTitle(), page.getUrl(), page.getContent());
    }

    public String buildSubqueryAnalysisPrompt(String subquery, String sourcesContent) {
        return """
                Based on the following analyses of web pages for the query: "%s",
                give a concise answer that addresses exactly this query.

                Analyzed web content:
                %s
                Your response should:
                1. Answer "%s" specifically
                2. Combine information from all relevant sources
                3. Cite sources with URLs where appropriate
                4. State your confidence (high/medium/low)
                """.formatted(subquery, sourcesContent, subquery);
    }

    /* =========================================================
     * SYNTHESIS
     * ========================================================= */
    public String buildSynthesisPrompt(String originalQuery,
                                       List<IntermediateResult> results,
                                       String evidence,
                                       boolean webOriented) {

        String label = webOriented ? "Search Query" : "Subquery";

        StringBuilder prompt = new StringBuilder();

        prompt.append("### TASK\n");
        prompt.append("Synthesize one comprehensive answer to a complex query from the results of its parts.\n\n");

        prompt.append("### ORIGINAL QUERY\n");
        prompt.append(originalQuery).append("\n\n");

        prompt.append("### PARTIAL RESULTS\n");
        for (int i = 0; i < results.size(); i++) {
            IntermediateResult r = results.get(i);
            prompt.append(label).append(" ").append(i + 1).append(": ").append(r.getSubquery()).append("\n");
            prompt.append("Results: ").append(r.getAnswer()).append("\n\n");
        }

        if (evidence != null && !evidence.isBlank()) {
            prompt.append("### SUPPORTING EVIDENCE\n");
            prompt.append(evidence).append("\n\n");
        }

        prompt.append("### REQUIREMENTS\n");
        prompt.append("1. Directly address the original query\n");
        prompt.append("2. Integrate information from all results\n");
        prompt.append("3. Present a logical flow of information\n");
        prompt.append("4. Avoid repeating the same point\n");
        prompt.append("5. Stay factually faithful to the source information\n");

        if (webOriented) {
            prompt.append("6. Cite web sources inline with their URLs in parentheses\n");
            prompt.append("7. Point out conflicting information and give a balanced perspective\n");
            prompt.append("8. Acknowledge significant information gaps\n\n");
        } else {
            prompt.append("6. Cite the titles of the source documents you rely on\n");
            prompt.append("7. If the results do not contain sufficient or relevant details, do not answer; ")
                  .append("state that there is no relevant context\n\n");
        }

        prompt.append("### ANSWER");

        return prompt.toString();
    }
}
