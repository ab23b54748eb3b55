package com.example.FinSolve.controller;

import com.example.FinSolve.access.HeaderIdentityResolver;
import com.example.FinSolve.exception.InvalidQueryException;
import com.example.FinSolve.model.AuthenticatedUser;
import com.example.FinSolve.model.ChatRequest;
import com.example.FinSolve.model.ChatResponse;
import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.QueryOutcome;
import com.example.FinSolve.model.Role;
import com.example.FinSolve.model.SourceCitation;
import com.example.FinSolve.service.QueryOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatController.class)
@Import(HeaderIdentityResolver.class)
class ChatControllerTest {

    private static final AuthenticatedUser PETER = new AuthenticatedUser("peter", Role.FINANCE);
    private static final Instant ANSWERED_AT = Instant.parse("2024-04-15T10:30:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QueryOrchestrator queryOrchestrator;

    @Test
    void deliveredAnswerIsReturnedWithSources() throws Exception {
        ChatResponse response = new ChatResponse("Q1 revenue was 2.1M USD.", List.of(
                new SourceCitation("quarterly_financial_report.md", DepartmentTag.FINANCE,
                        Instant.parse("2024-04-05T00:00:00Z"), 0.91)
        ), QueryOutcome.DELIVERED, "finance", ANSWERED_AT, "What was our Q1 2024 revenue?");
        when(queryOrchestrator.chat(eq(PETER), any(ChatRequest.class))).thenReturn(Mono.just(response));

        MvcResult result = mockMvc.perform(post("/api/chat")
                        .header(HeaderIdentityResolver.USER_HEADER, "peter")
                        .header(HeaderIdentityResolver.ROLE_HEADER, "finance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"What was our Q1 2024 revenue?\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Q1 revenue was 2.1M USD."))
                .andExpect(jsonPath("$.outcome").value("DELIVERED"))
                .andExpect(jsonPath("$.sources[0].file").value("quarterly_financial_report.md"))
                .andExpect(jsonPath("$.sources[0].department").value("FINANCE"))
                .andExpect(jsonPath("$.userRole").value("finance"))
                .andExpect(jsonPath("$.timestamp").exists())
                .andExpect(jsonPath("$.queryProcessed").value("What was our Q1 2024 revenue?"));
    }

    @Test
    void generationFailureIsServiceUnavailable() throws Exception {
        when(queryOrchestrator.chat(eq(PETER), any(ChatRequest.class))).thenReturn(Mono.just(
                new ChatResponse("The answer service is currently unavailable.", List.of(), QueryOutcome.FAILED,
                        "finance", ANSWERED_AT, "revenue?")));

        MvcResult result = mockMvc.perform(post("/api/chat")
                        .header(HeaderIdentityResolver.USER_HEADER, "peter")
                        .header(HeaderIdentityResolver.ROLE_HEADER, "finance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"revenue?\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.outcome").value("FAILED"))
                .andExpect(jsonPath("$.sources").isEmpty());
    }

    @Test
    void blankQueryIsBadRequest() throws Exception {
        when(queryOrchestrator.chat(eq(PETER), any(ChatRequest.class)))
                .thenReturn(Mono.error(new InvalidQueryException("Query must not be blank")));

        MvcResult result = mockMvc.perform(post("/api/chat")
                        .header(HeaderIdentityResolver.USER_HEADER, "peter")
                        .header(HeaderIdentityResolver.ROLE_HEADER, "finance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Query must not be blank"));
    }

    @Test
    void missingIdentityIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"revenue?\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Unauthorized"));

        verifyNoInteractions(queryOrchestrator);
    }

    @Test
    void listsAccessibleDepartments() throws Exception {
        when(queryOrchestrator.accessibleDepartments(PETER))
                .thenReturn(List.of(DepartmentTag.FINANCE, DepartmentTag.GENERAL));

        mockMvc.perform(get("/api/chat/departments")
                        .header(HeaderIdentityResolver.USER_HEADER, "peter")
                        .header(HeaderIdentityResolver.ROLE_HEADER, "finance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("finance"))
                .andExpect(jsonPath("$.departments[0]").value("finance"))
                .andExpect(jsonPath("$.departments[1]").value("general"));
    }

    @Test
    void clearsHistory() throws Exception {
        mockMvc.perform(delete("/api/chat/history")
                        .header(HeaderIdentityResolver.USER_HEADER, "peter")
                        .header(HeaderIdentityResolver.ROLE_HEADER, "finance"))
                .andExpect(status().isNoContent());

        verify(queryOrchestrator).clearHistory(PETER);
    }
}
