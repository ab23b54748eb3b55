package com.example.FinSolve.controller;

import com.example.FinSolve.access.IdentityResolver;
import com.example.FinSolve.model.AuthenticatedUser;
import com.example.FinSolve.model.ChatRequest;
import com.example.FinSolve.model.ChatResponse;
import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.QueryOutcome;
import com.example.FinSolve.model.ThinkingEvent;
import com.example.FinSolve.service.QueryOrchestrator;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final QueryOrchestrator queryOrchestrator;
    private final IdentityResolver identityResolver;

    /**
     * DELIVERED and REFUSED are normal answers; FAILED is reported as 503 with the same body.
     */
    @PostMapping
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest request, HttpServletRequest httpRequest) {
        AuthenticatedUser user = identityResolver.resolve(httpRequest);
        return queryOrchestrator.chat(user, request)
                .map(response -> ResponseEntity
                        .status(response.outcome() == QueryOutcome.FAILED ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK)
                        .body(response));
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamChat(@RequestBody ChatRequest request, HttpServletRequest httpRequest) {
        AuthenticatedUser user = identityResolver.resolve(httpRequest);
        // 0L means no timeout; generation itself is bounded by finsolve.generation.timeout
        SseEmitter emitter = new SseEmitter(0L);

        // Stages: received / access / rag / memory / generated / composed / answer_final|refused|failed
        Flux<ThinkingEvent> stream = queryOrchestrator.streamChat(user, request);

        Disposable subscription = stream.subscribe(
                event -> {
                    try {
                        emitter.send(
                                SseEmitter.event()
                                        .name(event.stage())
                                        .data(event)
                        );
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        // Client gone: cancel the pipeline
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }

    @GetMapping("/departments")
    public AccessibleDepartments departments(HttpServletRequest httpRequest) {
        AuthenticatedUser user = identityResolver.resolve(httpRequest);
        List<String> departments = queryOrchestrator.accessibleDepartments(user).stream()
                .map(DepartmentTag::label)
                .toList();
        return new AccessibleDepartments(user.role().label(), departments);
    }

    @DeleteMapping("/history")
    public ResponseEntity<Void> clearHistory(HttpServletRequest httpRequest) {
        AuthenticatedUser user = identityResolver.resolve(httpRequest);
        queryOrchestrator.clearHistory(user);
        return ResponseEntity.noContent().build();
    }

    public record AccessibleDepartments(String role, List<String> departments) { }
}
