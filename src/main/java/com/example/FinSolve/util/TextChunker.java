package com.example.FinSolve.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class TextChunker {

    private TextChunker() {
    }

    /**
     * Split text into word windows of {@code chunkSize} words, consecutive windows sharing
     * {@code overlap} words. A trailing window that would only repeat the overlap is dropped.
     */
    public static List<String> split(String text, int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, chunkSize), got " + overlap);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String[] words = text.trim().split("\\s+");
        List<String> chunks = new ArrayList<>();
        int step = chunkSize - overlap;
        int i = 0;
        while (i < words.length) {
            int end = Math.min(i + chunkSize, words.length);
            chunks.add(String.join(" ", Arrays.copyOfRange(words, i, end)));
            if (end == words.length) {
                break;
            }
            i += step;
        }
        return chunks;
    }
}
