package net.littleredcomputer.heap;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Ordering;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A mergeable priority queue backed by a leftist heap.
 * <p>
 * The element of highest priority is available in O(1); push, pop and merge take O(log n).
 * Priority is given by a comparator: {@code compare(a, b) < 0} means a has lower priority
 * than b, so under natural ordering the top is the maximum element.
 * <p>
 * The comparator is caller supplied and may throw at any comparison. Push, pop and merge
 * either complete or leave every heap involved exactly as it was, throwing
 * {@link HeapOperationException} with the comparator's exception as cause.
 * <p>
 * Not thread safe.
 */
public class LeftistHeap<T> {
    private static final Logger log = LogManager.getFormatterLogger(LeftistHeap.class);

    static final class Node<T> {
        final T value;
        Node<T> left;
        Node<T> right;
        int npl;  // null-path length; 1 for a leaf

        Node(T value, int npl) {
            this.value = value;
            this.npl = npl;
        }
    }

    private Node<T> root;
    private int cnt;
    private Comparator<? super T> comparator;
    private UnaryOperator<T> copier;

    /**
     * An empty heap under natural ordering, so that {@link #top()} is the maximum.
     */
    public static <T extends Comparable<? super T>> LeftistHeap<T> create() {
        return new LeftistHeap<T>(Ordering.<T>natural());
    }

    /**
     * An empty heap whose copies share element references with it.
     * @param comparator {@code compare(a, b) < 0} iff a has lower priority than b
     */
    public LeftistHeap(Comparator<? super T> comparator) {
        this(comparator, UnaryOperator.identity());
    }

    /**
     * An empty heap.
     * @param comparator {@code compare(a, b) < 0} iff a has lower priority than b
     * @param copier duplicates an element whenever the heap is copied or assigned from
     */
    public LeftistHeap(Comparator<? super T> comparator, UnaryOperator<T> copier) {
        this.comparator = checkNotNull(comparator, "comparator");
        this.copier = checkNotNull(copier, "copier");
    }

    /**
     * A deep copy of other: no node is shared, and each element is duplicated with the copier.
     * Any exception from the copier propagates as is.
     */
    public LeftistHeap(LeftistHeap<T> other) {
        checkNotNull(other, "other");
        this.root = copyOf(other.root, other.copier);
        this.cnt = other.cnt;
        this.comparator = other.comparator;
        this.copier = other.copier;
    }

    /**
     * Replace the contents, ordering and copier of this heap with a deep copy of other's.
     * The copy is built completely before this heap is touched, so if the copier throws
     * this heap is unchanged. Assigning a heap to itself does nothing.
     */
    public void assign(LeftistHeap<T> other) {
        checkNotNull(other, "other");
        if (other == this) return;
        Node<T> copy = copyOf(other.root, other.copier);
        root = copy;
        cnt = other.cnt;
        comparator = other.comparator;
        copier = other.copier;
    }

    /**
     * @return the element of highest priority, without removing it
     * @throws EmptyHeapException if the heap is empty
     */
    @Nonnull
    public T top() {
        if (cnt == 0) throw new EmptyHeapException("top");
        return root.value;
    }

    /**
     * @return the element of highest priority, or empty if there is none
     */
    public Optional<T> peek() {
        return cnt == 0 ? Optional.empty() : Optional.of(root.value);
    }

    /**
     * Insert an element.
     * @throws HeapOperationException if the comparator throws; the heap is unchanged
     */
    public void push(@Nonnull T value) {
        checkNotNull(value, "value");
        MeldResult<T> m = meld(root, new Node<>(value, 1));
        if (m.failed()) throw rolledBack("push", m);
        root = m.root();
        ++cnt;
    }

    /**
     * Remove the element of highest priority.
     * @return the removed element
     * @throws EmptyHeapException if the heap is empty
     * @throws HeapOperationException if the comparator throws; the heap is unchanged
     */
    @Nonnull
    public T pop() {
        if (cnt == 0) throw new EmptyHeapException("pop");
        Node<T> old = root;
        MeldResult<T> m = meld(old.left, old.right);
        if (m.failed()) throw rolledBack("pop", m);
        root = m.root();
        --cnt;
        old.left = old.right = null;
        return old.value;
    }

    /**
     * Move every element of other into this heap, leaving other empty. Merging a heap with
     * itself, or with an empty heap, does nothing.
     * @throws IllegalArgumentException if the two heaps are ordered by different comparators
     * @throws HeapOperationException if the comparator throws; neither heap is changed
     */
    public void merge(LeftistHeap<T> other) {
        checkNotNull(other, "other");
        if (other == this || other.cnt == 0) return;
        checkArgument(comparator.equals(other.comparator), "cannot merge heaps with different orderings");
        MeldResult<T> m = meld(root, other.root);
        if (m.failed()) throw rolledBack("merge", m);
        root = m.root();
        cnt += other.cnt;
        other.root = null;
        other.cnt = 0;
    }

    public void clear() {
        root = null;
        cnt = 0;
    }

    public int size() { return cnt; }
    public boolean isEmpty() { return cnt == 0; }
    public Comparator<? super T> comparator() { return comparator; }

    Node<T> root() { return root; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("size", cnt)
                .add("top", cnt == 0 ? null : root.value)
                .toString();
    }

    private HeapOperationException rolledBack(String operation, MeldResult<T> m) {
        log.debug("%s rolled back at size %d: %s", operation, cnt, m.failure());
        return new HeapOperationException(operation, m.failure());
    }

    private static int npl(Node<?> x) { return x == null ? 0 : x.npl; }

    /**
     * Meld two leftist trees, consuming both. A frame writes to its node only after the
     * recursive call beneath it has succeeded, so a failed result leaves both inputs intact.
     * Only the right spines are walked, so the depth is O(log n).
     */
    private MeldResult<T> meld(Node<T> a, Node<T> b) {
        if (a == null) return MeldResult.of(b);
        if (b == null) return MeldResult.of(a);
        final boolean bWins;
        try {
            bWins = comparator.compare(a.value, b.value) < 0;
        } catch (RuntimeException e) {
            return MeldResult.failed(e);
        }
        if (bWins) {
            Node<T> t = a;
            a = b;
            b = t;
        }
        MeldResult<T> m = meld(a.right, b);
        if (m.failed()) return m;
        a.right = m.root();
        if (npl(a.left) < npl(a.right)) {
            Node<T> t = a.left;
            a.left = a.right;
            a.right = t;
        }
        a.npl = npl(a.right) + 1;
        return MeldResult.of(a);
    }

    // Left spines can be as long as the heap, so the copy keeps its own stack.
    private static <T> Node<T> copyOf(Node<T> source, UnaryOperator<T> copier) {
        if (source == null) return null;
        Deque<Node<T>> sources = new ArrayDeque<>();
        Deque<Node<T>> copies = new ArrayDeque<>();
        Node<T> top = copyNode(source, copier);
        sources.push(source);
        copies.push(top);
        while (!sources.isEmpty()) {
            Node<T> s = sources.pop();
            Node<T> c = copies.pop();
            if (s.left != null) {
                c.left = copyNode(s.left, copier);
                sources.push(s.left);
                copies.push(c.left);
            }
            if (s.right != null) {
                c.right = copyNode(s.right, copier);
                sources.push(s.right);
                copies.push(c.right);
            }
        }
        return top;
    }

    private static <T> Node<T> copyNode(Node<T> n, UnaryOperator<T> copier) {
        return new Node<>(checkNotNull(copier.apply(n.value), "copier returned null"), n.npl);
    }
}
