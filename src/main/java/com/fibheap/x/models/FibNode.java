package com.fibheap.x.models;

import com.fibheap.x.list.ListLink;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * A value stored in a {@link FibonacciHeap} together with its structural links.
 * <p>
 * Nodes are created by callers and handed to {@link FibonacciHeap#insert(FibNode)};
 * keep the reference to decrease or delete the value later. The value is opaque to
 * the heap and is only read through the heap's comparator.
 * </p>
 */
public class FibNode<T> {
    @Getter
    @Setter
    private T value;

    FibNode<T> parent;
    final ListLink<FibNode<T>> siblings;
    final ListLink<FibNode<T>> children;
    int degree;
    boolean mark;

    public FibNode(T value) {
        this.value = value;
        this.siblings = new ListLink<>(this);
        this.children = ListLink.head();
    }

    void reset() {
        parent = null;
        degree = 0;
        mark = false;
    }

    public FibNode<T> getParent() {
        return parent;
    }

    public int getDegree() {
        return degree;
    }

    public boolean isMarked() {
        return mark;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Snapshot of the direct children, in child-list order.
     */
    public List<FibNode<T>> children() {
        return children.owners();
    }

    @Override
    public String toString() {
        return "FibNode{value=" + value + ", degree=" + degree + ", mark=" + mark + "}";
    }
}
