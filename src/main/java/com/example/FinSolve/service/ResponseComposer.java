package com.example.FinSolve.service;

import com.example.FinSolve.exception.GenerationUnavailableException;
import com.example.FinSolve.model.ChatResponse;
import com.example.FinSolve.model.Fragment;
import com.example.FinSolve.model.QueryOutcome;
import com.example.FinSolve.model.Role;
import com.example.FinSolve.model.ScoredFragment;
import com.example.FinSolve.model.SourceCitation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw completion into the user-facing answer with citations.
 * Citations come only from the fragments supplied to the generation step.
 */
@Component
@RequiredArgsConstructor
public class ResponseComposer {

    public static final String NO_ACCESSIBLE_CONTENT =
            "I couldn't find any relevant information to answer your query that you are authorized to access. "
                    + "Please try rephrasing your question or contact your administrator "
                    + "if you believe you should have access to this information.";

    public static final String GENERATION_UNAVAILABLE =
            "The answer service is currently unavailable. Please try again in a moment.";

    private final Clock clock;

    public ChatResponse compose(String rawCompletion, List<ScoredFragment> fragmentsUsed, Role role, String query) {
        if (rawCompletion == null || rawCompletion.isBlank()) {
            throw new GenerationUnavailableException("Generation service returned an empty completion");
        }
        return respond(rawCompletion.strip(), citations(fragmentsUsed), QueryOutcome.DELIVERED, role, query);
    }

    public ChatResponse refusal(Role role, String query) {
        return respond(NO_ACCESSIBLE_CONTENT, List.of(), QueryOutcome.REFUSED, role, query);
    }

    public ChatResponse unavailable(Role role, String query) {
        return respond(GENERATION_UNAVAILABLE, List.of(), QueryOutcome.FAILED, role, query);
    }

    private ChatResponse respond(String answer, List<SourceCitation> sources, QueryOutcome outcome,
                                 Role role, String query) {
        return new ChatResponse(answer, sources, outcome, role.label(), clock.instant(), query);
    }

    /**
     * One citation per source file, in rank order; the first (best scored) fragment of a file wins.
     */
    List<SourceCitation> citations(List<ScoredFragment> fragmentsUsed) {
        Map<String, SourceCitation> byFile = new LinkedHashMap<>();
        for (ScoredFragment sf : fragmentsUsed) {
            Fragment fragment = sf.fragment();
            byFile.putIfAbsent(fragment.sourceFile(), new SourceCitation(
                    fragment.sourceFile(),
                    fragment.department(),
                    fragment.updatedAt(),
                    sf.score()
            ));
        }
        return List.copyOf(byFile.values());
    }
}
