package com.cvtailor.ai.service.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic sliding-window splitter for embedding input.
 *
 * For a normalized text of length L, window W and overlap O it yields one
 * chunk when L ≤ W, otherwise ceil((L - O) / (W - O)) chunks; consecutive
 * chunks share exactly O characters and only the last one may be shorter
 * than W.
 */
public class Chunker {

    private final int defaultMaxWindow;
    private final int defaultOverlap;

    public Chunker(int defaultMaxWindow, int defaultOverlap) {
        validate(defaultMaxWindow, defaultOverlap);
        this.defaultMaxWindow = defaultMaxWindow;
        this.defaultOverlap = defaultOverlap;
    }

    public List<TextChunk> split(String text) {
        return split(text, defaultMaxWindow, defaultOverlap);
    }

    public List<TextChunk> split(String text, int maxWindow, int overlap) {
        validate(maxWindow, overlap);
        String normalized = ContentHasher.normalize(text);
        if (normalized.isEmpty()) {
            return List.of();
        }

        int length = normalized.length();
        if (length <= maxWindow) {
            return List.of(new TextChunk(0, 0, normalized));
        }

        int step = maxWindow - overlap;
        List<TextChunk> chunks = new ArrayList<>();
        int start = 0;
        while (true) {
            int end = Math.min(start + maxWindow, length);
            chunks.add(new TextChunk(chunks.size(), start, normalized.substring(start, end)));
            if (end == length) {
                break;
            }
            start += step;
        }
        return List.copyOf(chunks);
    }

    private static void validate(int maxWindow, int overlap) {
        if (maxWindow < 1) {
            throw new IllegalArgumentException("Chunk window must be positive: " + maxWindow);
        }
        if (overlap < 0 || overlap >= maxWindow) {
            throw new IllegalArgumentException(
                    "Chunk overlap must be in [0, window): overlap=" + overlap + ", window=" + maxWindow);
        }
    }
}
