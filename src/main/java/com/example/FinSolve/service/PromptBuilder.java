package com.example.FinSolve.service;

import com.example.FinSolve.config.FinSolveProperties;
import com.example.FinSolve.memory.ConversationMemoryService;
import com.example.FinSolve.model.GenerationRequest;
import com.example.FinSolve.model.Role;
import com.example.FinSolve.model.ScoredFragment;
import com.example.FinSolve.model.Turn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class PromptBuilder {

    private final FinSolveProperties properties;
    private final ConversationMemoryService memoryService;

    /**
     * Build the generation request:
     *  - textual conversation history (most recent last)
     *  - retrieved document context
     *  - user role and question
     */
    public GenerationRequest build(String query, Role role, List<ScoredFragment> fragments, List<Turn> history) {
        StringBuilder sb = new StringBuilder();
        sb.append("Conversation History:\n").append(memoryService.renderHistory(history)).append("\n\n");
        sb.append("User Role: ").append(role.label()).append("\n");
        sb.append("User Query: ").append(query).append("\n\n");
        sb.append("Context from company documents:\n").append(buildContext(fragments)).append("\n\n");
        sb.append("Response:");

        return new GenerationRequest(
                query,
                sb.toString(),
                fragments,
                history
        );
    }

    /**
     * Example format:
     *   [source=financial_summary.md, department=finance, score=0.873]
     *   fragment content...
     */
    String buildContext(List<ScoredFragment> fragments) {
        int maxChars = properties.getRetrieval().getMaxCharsPerFragment();
        return fragments.stream()
                .map(sf -> {
                    var fragment = sf.fragment();
                    return "[source=" + fragment.sourceFile()
                            + ", department=" + fragment.department().label()
                            + ", score=" + String.format(Locale.US, "%.3f", sf.score())
                            + "]\n"
                            + truncate(fragment.content(), maxChars);
                })
                .collect(Collectors.joining("\n\n"));
    }

    private static String truncate(String content, int maxChars) {
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }
        return content.substring(0, maxChars);
    }
}
