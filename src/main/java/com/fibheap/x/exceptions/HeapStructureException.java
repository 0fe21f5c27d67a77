package com.fibheap.x.exceptions;

/**
 * Exception thrown when a heap fails a structural check.
 * <p>
 * The heap itself never checks its preconditions on the hot path. This exception is raised by
 * {@link com.fibheap.x.validation.HeapValidator} when it finds a broken invariant, which usually
 * means a node was decreased or deleted through the wrong heap, or its value was raised in place.
 * </p>
 */
public class HeapStructureException extends RuntimeException {

    /**
     * Constructs a new {@link HeapStructureException} with the specified detail message.
     *
     * @param message the detail message naming the violated invariant and the offending node.
     */
    public HeapStructureException(String message) {
        super(message);
    }
}
