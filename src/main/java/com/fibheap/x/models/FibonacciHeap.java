package com.fibheap.x.models;

import com.fibheap.x.exceptions.HeapConsumedException;
import com.fibheap.x.list.ListLink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Mergeable min-priority queue with O(1) amortized insert, union and decrease-key, and
 * O(log n) amortized extract-min and delete.
 * <p>
 * Priority is defined by the comparator: {@code compare(a, b) < 0} means {@code a} is closer to
 * the minimum than {@code b}. The first entry of the root list is always the minimum. All
 * restructuring is deferred to {@link #extractMin()}.
 * </p>
 * <p>
 * Not thread-safe. {@link #decreaseKey(FibNode)} and {@link #delete(FibNode)} expect a node that
 * currently belongs to this heap; this is not checked.
 * </p>
 */
@Slf4j
public class FibonacciHeap<T> {
    private static final double LOG_PHI = Math.log((1 + Math.sqrt(5)) / 2);

    private final ListLink<FibNode<T>> roots = ListLink.head();
    private final Comparator<? super T> comparator;
    private int size;
    private int markedCount;
    private long linkCount;
    private long cutCount;
    private boolean consumed;

    public FibonacciHeap(Comparator<? super T> comparator) {
        this.comparator = Objects.requireNonNull(comparator, "Comparator cannot be null");
    }

    public static <T extends Comparable<? super T>> FibonacciHeap<T> naturalOrder() {
        return new FibonacciHeap<>(Comparator.naturalOrder());
    }

    public FibNode<T> insert(T value) {
        return insert(new FibNode<>(value));
    }

    public FibNode<T> insert(FibNode<T> node) {
        ensureUsable();
        Objects.requireNonNull(node, "Node cannot be null");
        if (node.siblings.isLinked()) {
            throw new IllegalStateException("Node already belongs to a heap");
        }
        node.reset();

        if (roots.isEmpty()) {
            node.siblings.insertHead(roots);
        } else {
            node.siblings.insertTail(roots);
            if (outranks(node, roots.first())) {
                node.siblings.moveToHead(roots);
            }
        }
        size++;
        return node;
    }

    public boolean isEmpty() {
        ensureUsable();
        return roots.isEmpty();
    }

    public int size() {
        ensureUsable();
        return size;
    }

    /**
     * @return the node holding the minimal value, or {@code null} if the heap is empty
     */
    public FibNode<T> minimum() {
        ensureUsable();
        return roots.first();
    }

    /**
     * Removes the minimal node and returns it, or returns {@code null} if the heap is empty.
     * The returned node is detached and may be inserted again.
     */
    public FibNode<T> extractMin() {
        ensureUsable();
        FibNode<T> z = roots.first();
        if (z == null) {
            return null;
        }

        if (z.hasChildren()) {
            for (ListLink<FibNode<T>> c = z.children.next(); !c.isHead(); c = c.next()) {
                FibNode<T> child = c.owner();
                child.parent = null;
                unmark(child);
            }
            z.children.spliceTail(roots);
        }
        z.siblings.remove();
        z.degree = 0;

        if (!roots.isEmpty()) {
            consolidate();
        }
        size--;
        return z;
    }

    /**
     * Moves every node of {@code other} into this heap.
     * <p>
     * If one side is empty the other one is returned untouched. Otherwise {@code other} is consumed:
     * it is left empty and any further call on it throws {@link HeapConsumedException}. Always keep
     * working with the returned heap.
     * </p>
     */
    public FibonacciHeap<T> union(FibonacciHeap<T> other) {
        ensureUsable();
        Objects.requireNonNull(other, "Heap to merge cannot be null");
        other.ensureUsable();
        if (other == this) {
            throw new IllegalArgumentException("A heap cannot be merged with itself");
        }

        if (other.roots.isEmpty()) return this;
        if (roots.isEmpty()) return other;

        FibNode<T> otherMin = other.roots.first();
        other.roots.spliceTail(roots);
        if (outranks(otherMin, roots.first())) {
            otherMin.siblings.moveToHead(roots);
        }

        size += other.size;
        markedCount += other.markedCount;
        linkCount += other.linkCount;
        cutCount += other.cutCount;
        other.size = 0;
        other.markedCount = 0;
        other.consumed = true;

        log.debug("Merged heap absorbed another heap, size now {}", size);
        return this;
    }

    /**
     * Restores heap order after the caller lowered the value held by {@code node}.
     * <p>
     * The old value is not known here, so a value that did not move is a structural no-op and a
     * value that grew leaves the heap order undefined. Use {@link #decreaseKey(FibNode, Object)}
     * to have the new value checked.
     * </p>
     */
    public void decreaseKey(FibNode<T> node) {
        ensureUsable();
        Objects.requireNonNull(node, "Node cannot be null");

        FibNode<T> parent = node.parent;
        if (parent != null && outranks(node, parent)) {
            cut(node, parent);
            cascadingCut(parent);
        }
        if (outranks(node, roots.first())) {
            node.siblings.moveToHead(roots);
        }
    }

    /**
     * Replaces the value of {@code node} with {@code newValue} and restores heap order.
     *
     * @throws IllegalArgumentException if {@code newValue} ranks after the current value
     */
    public void decreaseKey(FibNode<T> node, T newValue) {
        ensureUsable();
        Objects.requireNonNull(node, "Node cannot be null");
        if (comparator.compare(newValue, node.getValue()) > 0) {
            throw new IllegalArgumentException("New value " + newValue + " ranks after current value " + node.getValue());
        }
        node.setValue(newValue);
        decreaseKey(node);
    }

    /**
     * Removes {@code node} from the heap without touching its value. The node is detached afterwards.
     */
    public void delete(FibNode<T> node) {
        ensureUsable();
        Objects.requireNonNull(node, "Node cannot be null");

        FibNode<T> parent = node.parent;
        if (parent != null) {
            cut(node, parent);
            cascadingCut(parent);
        }
        node.siblings.moveToHead(roots);
        extractMin();
    }

    /**
     * Detaches every node. O(n).
     */
    public void clear() {
        ensureUsable();
        Deque<FibNode<T>> pending = new ArrayDeque<>(roots.owners());
        while (!pending.isEmpty()) {
            FibNode<T> node = pending.pop();
            pending.addAll(node.children.owners());
            node.siblings.remove();
            node.reset();
        }
        size = 0;
        markedCount = 0;
    }

    public Comparator<? super T> comparator() {
        return comparator;
    }

    /**
     * Snapshot of the root list; the minimum comes first.
     */
    public List<FibNode<T>> roots() {
        ensureUsable();
        return roots.owners();
    }

    public int treeCount() {
        ensureUsable();
        return roots.size();
    }

    public int markedCount() {
        return markedCount;
    }

    public long linkCount() {
        return linkCount;
    }

    public long cutCount() {
        return cutCount;
    }

    public boolean isConsumed() {
        return consumed;
    }

    static int maxDegree(int n) {
        return (int) Math.floor(Math.log(n) / LOG_PHI);
    }

    private void consolidate() {
        int maxDegree = maxDegree(size);
        @SuppressWarnings("unchecked")
        FibNode<T>[] slots = (FibNode<T>[]) new FibNode[maxDegree + 1];

        // linking only moves nodes already visited, so the cursor stays valid
        int rootCount = roots.size();
        ListLink<FibNode<T>> cursor = roots.next();
        for (int i = 0; i < rootCount; i++) {
            FibNode<T> x = cursor.owner();
            cursor = cursor.next();

            int d = x.degree;
            while (slots[d] != null) {
                FibNode<T> y = slots[d];
                if (outranks(y, x)) {
                    FibNode<T> tmp = x;
                    x = y;
                    y = tmp;
                }
                link(y, x);
                slots[d] = null;
                d++;
            }
            slots[d] = x;
        }

        FibNode<T> min = null;
        int trees = 0;
        for (FibNode<T> root : slots) {
            if (root == null) continue;
            trees++;
            root.siblings.remove();
            root.parent = null;
            if (min == null) {
                root.siblings.insertHead(roots);
                min = root;
            } else {
                root.siblings.insertTail(roots);
                if (outranks(root, min)) {
                    root.siblings.moveToHead(roots);
                    min = root;
                }
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Consolidated {} roots into {} trees, maxDegree={}", rootCount, trees, maxDegree);
        }
    }

    private void link(FibNode<T> child, FibNode<T> parent) {
        child.siblings.remove();
        child.siblings.insertTail(parent.children);
        child.parent = parent;
        parent.degree++;
        unmark(child);
        linkCount++;
    }

    private void cut(FibNode<T> node, FibNode<T> parent) {
        node.siblings.remove();
        parent.degree--;
        node.siblings.insertTail(roots);
        node.parent = null;
        unmark(node);
        cutCount++;
    }

    private void cascadingCut(FibNode<T> node) {
        FibNode<T> current = node;
        FibNode<T> parent = current.parent;
        while (parent != null) {
            if (!current.mark) {
                current.mark = true;
                markedCount++;
                return;
            }
            cut(current, parent);
            current = parent;
            parent = current.parent;
        }
    }

    private void unmark(FibNode<T> node) {
        if (node.mark) {
            node.mark = false;
            markedCount--;
        }
    }

    private boolean outranks(FibNode<T> a, FibNode<T> b) {
        return comparator.compare(a.getValue(), b.getValue()) < 0;
    }

    private void ensureUsable() {
        if (consumed) {
            throw new HeapConsumedException("Heap was merged into another heap and can no longer be used");
        }
    }
}
