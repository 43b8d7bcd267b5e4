package com.solast.ast;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out node ids. Ids are never reused within a process.
 */
public final class NodeIds {

    private static final AtomicLong NEXT = new AtomicLong();

    private NodeIds() {
        // Utility class
    }

    public static long next() {
        return NEXT.getAndIncrement();
    }
}
