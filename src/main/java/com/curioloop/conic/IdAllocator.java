/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

/**
 * Monotonic source of identifiers for variables, parameters and constraints.
 * <p>
 * Every id is strictly greater than all ids previously issued by the same
 * allocator and is never reused. Ids also fix the global column order used
 * when a problem is assembled.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is <b>not thread-safe</b>. An allocator belongs to one
 * {@link ModelContext} and must only be used by one thread at a time.
 * </p>
 */
public final class IdAllocator {

    private int last;

    /**
     * Creates an allocator whose first id is 1.
     */
    public IdAllocator() {
        this(0);
    }

    /**
     * Creates an allocator whose first id is {@code start + 1}.
     * @param start Last id considered already issued
     */
    public IdAllocator(int start) {
        if (start < 0) {
            throw new IllegalArgumentException("Start must be non-negative");
        }
        this.last = start;
    }

    /**
     * Allocates the next id.
     * @return Fresh id
     * @throws IllegalStateException if the id space is exhausted
     */
    public int nextId() {
        if (last == Integer.MAX_VALUE) {
            throw new IllegalStateException("Identifier space exhausted");
        }
        return ++last;
    }

    /**
     * Gets the most recently issued id.
     * @return Last id, or the start value if none was issued
     */
    public int lastId() {
        return last;
    }
}
