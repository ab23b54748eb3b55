package com.example.FinSolve.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the assistant.
 *
 * <p>Bound from {@code finsolve.*} in {@code application.yml}.</p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "finsolve")
public class FinSolveProperties {

    private Retrieval retrieval = new Retrieval();
    private Memory memory = new Memory();
    private Generation generation = new Generation();
    private Index index = new Index();
    private Corpus corpus = new Corpus();

    @Data
    public static class Retrieval {
        /** Number of fragments requested from the index. */
        private int topK = 5;

        /** Fragments below this cosine similarity do not count as matches. */
        private double minScore = 0.25;

        /** Fragments actually handed to the generation step; only these are cited. */
        private int maxContextFragments = 3;

        /** Each fragment is cut to this many characters inside the prompt. */
        private int maxCharsPerFragment = 400;
    }

    @Data
    public static class Memory {
        /** Turns kept per user session (N). Older turns are evicted first. */
        private int windowSize = 5;
    }

    @Data
    public static class Generation {
        /** Upper bound for a single generation call. */
        private Duration timeout = Duration.ofSeconds(30);

        /** Preferred chat model, e.g. "deepseek" or "openai". */
        private String model = "deepseek";

        private String systemPrompt = """
                You are an AI assistant for FinSolve Technologies, a FinTech company.
                Provide helpful, accurate, and concise responses based only on the provided context.
                If the information is not in the context, state that explicitly.
                Always cite the document names from the context when referencing information.
                Use the conversation history to maintain context for follow-up questions.
                Keep responses to a maximum of 4 lines.""";
    }

    @Data
    public static class Index {
        /** "in-memory" (default) or "pgvector". */
        private String store = "in-memory";
    }

    @Data
    public static class Corpus {
        /** Load markdown documents into the in-memory index at startup. */
        private boolean enabled = false;

        /** Root directory; one sub-directory per department label. */
        private String location = "resources/data";

        /** Words per chunk. */
        private int chunkSize = 500;

        /** Words shared by consecutive chunks. */
        private int chunkOverlap = 50;
    }
}
