package com.agentsearch.service.agent;

import com.agentsearch.dto.internal.ConversationTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Folds the most recent conversation turns into the query so that a follow-up
 * question can be decomposed on its own.
 */
@Slf4j
@Component
public class ConversationFormatter {

    static final int MAX_TURNS = 3;

    public String format(String query, List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return query;
        }

        List<ConversationTurn> recent = history.subList(Math.max(0, history.size() - MAX_TURNS), history.size());

        StringBuilder turns = new StringBuilder();
        for (ConversationTurn turn : recent) {
            String role = turn != null && turn.getRole() != null ? turn.getRole().trim() : "";
            if (role.isEmpty() || "system".equalsIgnoreCase(role)) {
                continue;
            }
            String content = turn.getContent() != null ? turn.getContent().trim() : "";
            if (content.isEmpty()) {
                continue;
            }
            turns.append(capitalize(role)).append(": ").append(content).append("\n");
        }

        if (turns.length() == 0) {
            return query;
        }

        log.debug("Folded {} prior turns into the query", recent.size());
        return "Previous conversation:\n" + turns
            + "\nConsidering the conversation above, answer this follow-up question: " + query;
    }

    private static String capitalize(String role) {
        return Character.toUpperCase(role.charAt(0)) + role.substring(1).toLowerCase(Locale.ROOT);
    }
}
