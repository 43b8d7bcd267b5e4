package com.solast.json;

import com.solast.ast.SourceLocation;

import java.util.Map;

/**
 * Encodes source locations as the positional {@code "start:length:sourceIndex"} strings found
 * in the {@code src} attribute of every document.
 *
 * <p>Unknown parts are encoded, not rejected: the length is -1 unless both offsets are
 * non-negative, and the source index is -1 unless the source name is in the table.</p>
 */
public final class SourceLocationEncoder {

    private final Map<String, Integer> sourceIndices;

    public SourceLocationEncoder(Map<String, Integer> sourceIndices) {
        this.sourceIndices = Map.copyOf(sourceIndices);
    }

    public String encode(SourceLocation location) {
        int sourceIndex = -1;
        if (location.sourceName() != null && sourceIndices.containsKey(location.sourceName())) {
            sourceIndex = sourceIndices.get(location.sourceName());
        }
        int length = -1;
        if (location.start() >= 0 && location.end() >= 0) {
            length = location.end() - location.start();
        }
        return location.start() + ":" + length + ":" + sourceIndex;
    }

    /**
     * Parses a {@code src} string back into its three fields.
     *
     * @throws AstJsonException if the text does not have three integer fields
     */
    public static Src decode(String src) {
        String[] parts = src.split(":", -1);
        if (parts.length != 3) {
            throw new AstJsonException("Malformed source location '" + src + "': expected start:length:sourceIndex");
        }
        try {
            return new Src(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new AstJsonException("Malformed source location '" + src + "'", e);
        }
    }

    /**
     * A decoded {@code src} attribute. Negative length or source index mean unknown.
     */
    public record Src(int start, int length, int sourceIndex) {

        public boolean hasLength() {
            return length >= 0;
        }

        /**
         * End offset, or -1 if the length is unknown.
         */
        public int end() {
            return hasLength() ? start + length : -1;
        }
    }
}
