package com.fibheap.x.models;

import java.util.AbstractQueue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * {@link java.util.Queue} view over a {@link FibonacciHeap}.
 * <p>
 * The iterator walks a snapshot of the stored elements in no particular order and does not
 * support removal. {@link #remove(Object)} is O(n) to locate the element.
 * </p>
 */
public class FibonacciPriorityQueue<E> extends AbstractQueue<E> {
    private final FibonacciHeap<E> heap;

    public FibonacciPriorityQueue(Comparator<? super E> comparator) {
        this.heap = new FibonacciHeap<>(comparator);
    }

    public static <E extends Comparable<? super E>> FibonacciPriorityQueue<E> naturalOrder() {
        return new FibonacciPriorityQueue<>(Comparator.naturalOrder());
    }

    @Override
    public boolean offer(E e) {
        Objects.requireNonNull(e, "Queue elements cannot be null");
        heap.insert(e);
        return true;
    }

    @Override
    public E poll() {
        FibNode<E> node = heap.extractMin();
        return node != null ? node.getValue() : null;
    }

    @Override
    public E peek() {
        FibNode<E> node = heap.minimum();
        return node != null ? node.getValue() : null;
    }

    @Override
    public int size() {
        return heap.size();
    }

    @Override
    public void clear() {
        heap.clear();
    }

    @Override
    public boolean remove(Object o) {
        if (o == null) return false;
        FibNode<E> node = find(o);
        if (node == null) return false;
        heap.delete(node);
        return true;
    }

    @Override
    public Iterator<E> iterator() {
        List<E> values = new ArrayList<>(heap.size());
        for (FibNode<E> node : nodes()) {
            values.add(node.getValue());
        }
        return Collections.unmodifiableList(values).iterator();
    }

    private FibNode<E> find(Object o) {
        for (FibNode<E> node : nodes()) {
            if (o.equals(node.getValue())) return node;
        }
        return null;
    }

    private List<FibNode<E>> nodes() {
        List<FibNode<E>> result = new ArrayList<>(heap.size());
        List<FibNode<E>> pending = new ArrayList<>(heap.roots());
        while (!pending.isEmpty()) {
            FibNode<E> node = pending.remove(pending.size() - 1);
            result.add(node);
            pending.addAll(node.children());
        }
        return result;
    }
}
