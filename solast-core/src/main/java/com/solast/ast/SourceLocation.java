package com.solast.ast;

/**
 * Byte offset range within a named source. Negative offsets mean unknown.
 */
public record SourceLocation(int start, int end, String sourceName) {

    public static SourceLocation unknown() {
        return new SourceLocation(-1, -1, null);
    }

    public SourceLocation(int start, int end) {
        this(start, end, null);
    }
}
