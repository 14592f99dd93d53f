package com.cvtailor.ai.service.text;

/**
 * One window produced by {@link Chunker}.
 *
 * @param index position in the sequence, starting at 0
 * @param start offset of the first character in the normalized text
 * @param text  window content
 */
public record TextChunk(int index, int start, String text) {

    public int end() {
        return start + text.length();
    }
}
