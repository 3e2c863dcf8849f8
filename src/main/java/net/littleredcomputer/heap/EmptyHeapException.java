package net.littleredcomputer.heap;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link LeftistHeap#top()} and {@link LeftistHeap#pop()} when the heap has no elements.
 * The heap is never modified when this is thrown.
 */
public class EmptyHeapException extends NoSuchElementException {
    EmptyHeapException(String operation) {
        super(operation + " from empty heap");
    }
}
