package net.littleredcomputer.heap;

import org.junit.Test;

import java.util.Comparator;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class LeftistHeapCopyTest {

    static class Box {
        final int v;
        Box(int v) { this.v = v; }
    }

    private static final Comparator<Box> byValue = Comparator.comparingInt(b -> b.v);

    static class CopyFailed extends RuntimeException {}

    @Test
    public void copyIsIndependent() {
        LeftistHeap<Integer> h = LeftistHeapTest.of(5, 3, 8, 1);
        LeftistHeap<Integer> c = new LeftistHeap<>(h);
        assertThat(HeapInvariants.shape(c), is(HeapInvariants.shape(h)));
        c.pop();
        c.push(100);
        assertThat(h.size(), is(4));
        assertThat(h.top(), is(8));
        h.merge(LeftistHeapTest.of(50));
        assertThat(c.top(), is(100));
        assertThat(c.size(), is(4));
        assertThat(LeftistHeapTest.drain(h), contains(50, 8, 5, 3, 1));
        assertThat(LeftistHeapTest.drain(c), contains(100, 5, 3, 1));
    }

    @Test
    public void copyOfEmpty() {
        LeftistHeap<Integer> c = new LeftistHeap<>(LeftistHeap.<Integer>create());
        HeapInvariants.checkEmpty(c);
        c.push(1);
        assertThat(c.top(), is(1));
    }

    @Test
    public void copierDuplicatesElements() {
        LeftistHeap<Box> h = new LeftistHeap<>(byValue, b -> new Box(b.v));
        Box seven = new Box(7);
        h.push(seven);
        h.push(new Box(2));
        LeftistHeap<Box> c = new LeftistHeap<>(h);
        assertThat(c.top().v, is(7));
        assertThat(c.top(), is(not(sameInstance(seven))));
        assertSame(h.comparator(), c.comparator());
        // and the copy keeps the copier
        LeftistHeap<Box> cc = new LeftistHeap<>(c);
        assertThat(cc.top(), is(not(sameInstance(c.top()))));
    }

    @Test
    public void assign() {
        LeftistHeap<Integer> h = LeftistHeapTest.of(1, 2, 3);
        LeftistHeap<Integer> g = new LeftistHeap<>(Comparator.reverseOrder());
        g.push(10);
        g.push(20);
        h.assign(g);
        assertThat(h.size(), is(2));
        assertThat(h.top(), is(10));
        assertSame(g.comparator(), h.comparator());
        h.push(5);
        assertThat(g.size(), is(2));
        assertThat(LeftistHeapTest.drain(h), contains(5, 10, 20));
        assertThat(g.top(), is(10));
    }

    @Test
    public void selfAssignment() {
        LeftistHeap<Integer> h = LeftistHeapTest.of(4, 6);
        String shape = HeapInvariants.shape(h);
        h.assign(h);
        assertThat(HeapInvariants.shape(h), is(shape));
        assertThat(h.size(), is(2));
    }

    @Test
    public void failedAssignmentLeavesTargetUnchanged() {
        AtomicInteger copies = new AtomicInteger();
        UnaryOperator<Box> flaky = b -> {
            if (copies.incrementAndGet() == 3) throw new CopyFailed();
            return new Box(b.v);
        };
        LeftistHeap<Box> source = new LeftistHeap<>(byValue, flaky);
        for (int i = 0; i < 5; ++i) source.push(new Box(i));
        LeftistHeap<Box> target = new LeftistHeap<>(byValue);
        target.push(new Box(42));
        try {
            target.assign(source);
            fail("expected CopyFailed");
        } catch (CopyFailed e) {
            // propagated unwrapped
        }
        assertThat(target.size(), is(1));
        assertThat(target.top().v, is(42));
        assertSame(byValue, target.comparator());
        assertThat(source.size(), is(5));
        HeapInvariants.check(target);
        HeapInvariants.check(source);
    }

    @Test(expected = CopyFailed.class)
    public void failedCopyConstructionPropagates() {
        LeftistHeap<Box> source = new LeftistHeap<>(byValue, b -> { throw new CopyFailed(); });
        source.push(new Box(1));
        new LeftistHeap<>(source);
    }
}
