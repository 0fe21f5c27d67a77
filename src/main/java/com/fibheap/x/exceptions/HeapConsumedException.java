package com.fibheap.x.exceptions;

/**
 * Exception thrown when a heap is used after its nodes were absorbed by another heap.
 * <p>
 * {@code union} moves every node of the second heap into the first one and leaves the
 * second heap unusable. Any later call on the consumed heap raises this exception.
 * </p>
 */
public class HeapConsumedException extends IllegalStateException {

    /**
     * Constructs a new {@link HeapConsumedException} with the specified detail message.
     *
     * @param message the detail message explaining which operation was attempted.
     */
    public HeapConsumedException(String message) {
        super(message);
    }
}
