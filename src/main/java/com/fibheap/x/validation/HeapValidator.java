package com.fibheap.x.validation;

import com.fibheap.x.exceptions.HeapStructureException;
import com.fibheap.x.models.FibNode;
import com.fibheap.x.models.FibonacciHeap;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full structural check of a {@link FibonacciHeap}.
 * <p>
 * Walks every node reachable from the root list and verifies heap order, the minimum pointer,
 * the node count, degrees, parent back-references and mark bookkeeping. The walk is O(n), so it
 * is meant for tests and for diagnosing misuse, not for production paths.
 * </p>
 */
@Slf4j
@UtilityClass
public class HeapValidator {

    /**
     * Validates the given heap.
     *
     * @param heap the heap to inspect
     * @throws HeapStructureException describing the first violated invariant
     */
    public static <T> void validate(FibonacciHeap<T> heap) {
        Comparator<? super T> comparator = heap.comparator();
        List<FibNode<T>> roots = heap.roots();
        Map<FibNode<T>, Boolean> seen = new IdentityHashMap<>();
        Deque<FibNode<T>> pending = new ArrayDeque<>();

        FibNode<T> min = roots.isEmpty() ? null : roots.get(0);
        if (heap.isEmpty() != (min == null)) {
            throw new HeapStructureException("isEmpty() disagrees with the root list");
        }

        for (FibNode<T> root : roots) {
            if (root.getParent() != null) {
                throw new HeapStructureException("Root " + root + " has a parent");
            }
            if (root.isMarked()) {
                throw new HeapStructureException("Root " + root + " is marked");
            }
            pending.push(root);
        }

        int count = 0;
        int marked = 0;
        while (!pending.isEmpty()) {
            FibNode<T> node = pending.pop();
            if (seen.put(node, Boolean.TRUE) != null) {
                throw new HeapStructureException("Node " + node + " is reachable twice");
            }
            count++;
            if (node.isMarked()) marked++;
            if (comparator.compare(node.getValue(), min.getValue()) < 0) {
                throw new HeapStructureException("Node " + node + " outranks the minimum " + min);
            }

            List<FibNode<T>> children = node.children();
            if (children.size() != node.getDegree()) {
                throw new HeapStructureException("Node " + node + " has " + children.size() + " children but degree " + node.getDegree());
            }
            for (FibNode<T> child : children) {
                if (child.getParent() != node) {
                    throw new HeapStructureException("Child " + child + " does not point back to its parent " + node);
                }
                if (comparator.compare(child.getValue(), node.getValue()) < 0) {
                    throw new HeapStructureException("Child " + child + " outranks its parent " + node);
                }
                pending.push(child);
            }
        }

        if (count != heap.size()) {
            throw new HeapStructureException("Heap reports size " + heap.size() + " but " + count + " nodes are reachable");
        }
        if (marked != heap.markedCount()) {
            throw new HeapStructureException("Heap reports " + heap.markedCount() + " marked nodes but " + marked + " are marked");
        }
    }

    public static <T> boolean isValid(FibonacciHeap<T> heap) {
        try {
            validate(heap);
            return true;
        } catch (HeapStructureException e) {
            log.warn("Heap failed validation: {}", e.getMessage());
            return false;
        }
    }
}
