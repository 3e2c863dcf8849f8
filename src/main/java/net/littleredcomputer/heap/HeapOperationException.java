package net.littleredcomputer.heap;

/**
 * Thrown when a push, pop or merge could not be completed because the ordering failed
 * partway through. The cause is whatever the comparator threw. When this is thrown, every
 * heap taking part in the operation holds exactly the elements it held before the call.
 */
public class HeapOperationException extends RuntimeException {
    private final String operation;

    HeapOperationException(String operation, Throwable cause) {
        super(operation + " failed; heap left unchanged", cause);
        this.operation = operation;
    }

    public String getOperation() { return operation; }
}
