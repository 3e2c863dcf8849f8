package net.littleredcomputer.heap;

/**
 * Outcome of one meld: either the root of the melded tree, or the failure that stopped it.
 * A failed result means no node of either input was modified.
 */
final class MeldResult<T> {
    private final LeftistHeap.Node<T> root;
    private final RuntimeException failure;

    private MeldResult(LeftistHeap.Node<T> root, RuntimeException failure) {
        this.root = root;
        this.failure = failure;
    }

    static <T> MeldResult<T> of(LeftistHeap.Node<T> root) { return new MeldResult<>(root, null); }
    static <T> MeldResult<T> failed(RuntimeException failure) { return new MeldResult<>(null, failure); }

    boolean failed() { return failure != null; }

    LeftistHeap.Node<T> root() {
        if (failure != null) throw new IllegalStateException("no root in a failed meld", failure);
        return root;
    }

    RuntimeException failure() { return failure; }
}
