package com.example.FinSolve.service;

import com.example.FinSolve.access.RoleAccessPolicy;
import com.example.FinSolve.config.FinSolveProperties;
import com.example.FinSolve.exception.GenerationUnavailableException;
import com.example.FinSolve.exception.InvalidQueryException;
import com.example.FinSolve.index.DocumentIndex;
import com.example.FinSolve.memory.ConversationMemoryService;
import com.example.FinSolve.model.AuthenticatedUser;
import com.example.FinSolve.model.ChatRequest;
import com.example.FinSolve.model.ChatResponse;
import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.GenerationRequest;
import com.example.FinSolve.model.QueryStage;
import com.example.FinSolve.model.RetrievalResult;
import com.example.FinSolve.model.ScoredFragment;
import com.example.FinSolve.model.ThinkingEvent;
import com.example.FinSolve.model.Turn;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Runs one query through the pipeline:
 * access resolution -> filtered retrieval -> history merge -> generation -> composition -> memory.
 *
 * Retrieval and generation block, so both run on boundedElastic and never hold up other queries.
 * Memory is only written after generation succeeded; a refused or failed query leaves it untouched.
 */
@Service
@RequiredArgsConstructor
public class QueryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(QueryOrchestrator.class);

    private final RoleAccessPolicy accessPolicy;
    private final DocumentIndex documentIndex;
    private final ConversationMemoryService memoryService;
    private final PromptBuilder promptBuilder;
    private final GenerationService generationService;
    private final ResponseComposer responseComposer;
    private final QueryAuditService auditService;
    private final FinSolveProperties properties;

    public Mono<ChatResponse> chat(AuthenticatedUser user, ChatRequest request) {
        return chat(user, request, QueryStageListener.NONE);
    }

    public Mono<ChatResponse> chat(AuthenticatedUser user, ChatRequest request, QueryStageListener listener) {
        return Mono.defer(() -> {
            String query = request.query();
            if (query == null || query.isBlank()) {
                return Mono.error(new InvalidQueryException("Query must not be blank"));
            }
            log.info("Processing query for user={} (role={}): {}", user.userId(), user.role().label(), query);
            listener.onStage(QueryStage.RECEIVED, query);

            Set<DepartmentTag> allowed = accessPolicy.allowedDepartments(user.role());
            listener.onStage(QueryStage.AUTHORIZED_DEPARTMENTS_RESOLVED, labels(allowed));

            int topK = properties.getRetrieval().getTopK();
            double minScore = properties.getRetrieval().getMinScore();
            return Mono.fromCallable(() -> documentIndex.query(query, topK, allowed, minScore))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(retrieval -> afterRetrieval(user, request, retrieval, listener));
        });
    }

    /**
     * Same pipeline, exposed as a stream of stage events ending with the terminal stage.
     * Cancelling the stream cancels the in-flight retrieval or generation call.
     */
    public Flux<ThinkingEvent> streamChat(AuthenticatedUser user, ChatRequest request) {
        return Flux.create(sink -> {
            Disposable subscription = chat(user, request,
                    (stage, payload) -> sink.next(new ThinkingEvent(stage.eventName(), describe(stage), payload)))
                    .subscribe(response -> sink.complete(), sink::error);
            sink.onDispose(subscription);
        });
    }

    public List<DepartmentTag> accessibleDepartments(AuthenticatedUser user) {
        return accessPolicy.accessibleDepartments(user.role());
    }

    public void clearHistory(AuthenticatedUser user) {
        memoryService.clear(user.userId());
    }

    private Mono<ChatResponse> afterRetrieval(AuthenticatedUser user,
                                              ChatRequest request,
                                              RetrievalResult retrieval,
                                              QueryStageListener listener) {
        log.info("Found {} accessible fragments for user={}", retrieval.fragments().size(), user.userId());
        listener.onStage(QueryStage.RETRIEVED, summarizeRetrieval(retrieval.fragments()));

        if (retrieval.isEmpty()) {
            ChatResponse refusal = responseComposer.refusal(user.role(), request.query());
            auditService.record(user.userId(), user.role(), request.query(), refusal);
            listener.onStage(QueryStage.REFUSED, refusal);
            return Mono.just(refusal);
        }

        List<ScoredFragment> used = retrieval.top(properties.getRetrieval().getMaxContextFragments());
        int priorTurns = request.resolvePriorTurns(memoryService.windowSize());
        List<Turn> history = memoryService.recent(user.userId(), priorTurns);
        GenerationRequest generationRequest = promptBuilder.build(request.query(), user.role(), used, history);
        listener.onStage(QueryStage.CONTEXT_MERGED, Map.of("priorTurns", history.size(), "fragments", used.size()));

        return Mono.fromCallable(() -> generationService.complete(generationRequest))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(properties.getGeneration().getTimeout())
                .map(raw -> {
                    listener.onStage(QueryStage.GENERATED, null);
                    ChatResponse response = responseComposer.compose(raw, used, user.role(), request.query());
                    listener.onStage(QueryStage.COMPOSED, null);
                    return response;
                })
                .doOnNext(response -> {
                    memoryService.appendCompleted(user.userId(), request.query(), response.answer(), response.sources());
                    auditService.record(user.userId(), user.role(), request.query(), response);
                    listener.onStage(QueryStage.DELIVERED, response);
                })
                .onErrorResume(QueryOrchestrator::isGenerationFailure, ex -> {
                    log.warn("Generation unavailable for user={}: {}", user.userId(), ex.toString());
                    ChatResponse failed = responseComposer.unavailable(user.role(), request.query());
                    auditService.record(user.userId(), user.role(), request.query(), failed);
                    listener.onStage(QueryStage.FAILED, failed);
                    return Mono.just(failed);
                });
    }

    private static boolean isGenerationFailure(Throwable ex) {
        return ex instanceof GenerationUnavailableException || ex instanceof TimeoutException;
    }

    private static List<String> labels(Set<DepartmentTag> departments) {
        return departments.stream()
                .sorted()
                .map(DepartmentTag::label)
                .toList();
    }

    /**
     * Source metadata only; fragment text is not streamed to the client.
     */
    private static List<Map<String, Object>> summarizeRetrieval(List<ScoredFragment> fragments) {
        return fragments.stream()
                .map(sf -> Map.<String, Object>of(
                        "file", sf.fragment().sourceFile(),
                        "department", sf.fragment().department().label(),
                        "score", sf.score()
                ))
                .toList();
    }

    private static String describe(QueryStage stage) {
        return switch (stage) {
            case RECEIVED -> "Request received.";
            case AUTHORIZED_DEPARTMENTS_RESOLVED -> "Resolved departments visible to your role.";
            case RETRIEVED -> "Searched accessible documents.";
            case CONTEXT_MERGED -> "Combined documents with previous conversation.";
            case GENERATED -> "Generated answer.";
            case COMPOSED -> "Attached sources.";
            case DELIVERED -> "Finalized answer.";
            case REFUSED -> "No accessible information found.";
            case FAILED -> "Generation unavailable.";
        };
    }
}
