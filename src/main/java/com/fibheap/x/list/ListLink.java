package com.fibheap.x.list;

import java.util.ArrayList;
import java.util.List;

/**
 * Circular doubly-linked list link meant to be embedded in the object it chains.
 * <p>
 * The same class is used for the list handle and for the entries. A handle is a
 * sentinel created with {@link #head()} and has no owner; an entry is created with
 * its owning object and starts detached (linked to itself). Entries are located
 * through {@link #owner()}, so no wrapper objects are allocated per insertion.
 * </p>
 * <p>
 * All structural operations are O(1). The list imposes no ordering beyond the
 * insertion point; callers decide what "first" means.
 * </p>
 *
 * @param <E> type of the object embedding the link
 */
public final class ListLink<E> {
    private final E owner;
    private final boolean sentinel;
    private ListLink<E> prev;
    private ListLink<E> next;

    /**
     * Creates a detached entry for {@code owner}.
     *
     * @param owner the object embedding this link, never {@code null}
     */
    public ListLink(E owner) {
        if (owner == null) throw new NullPointerException("Link owner cannot be null");
        this.owner = owner;
        this.sentinel = false;
        this.prev = this.next = this;
    }

    private ListLink() {
        this.owner = null;
        this.sentinel = true;
        this.prev = this.next = this;
    }

    /**
     * Creates an empty list handle.
     */
    public static <E> ListLink<E> head() {
        return new ListLink<>();
    }

    public E owner() {
        return owner;
    }

    public ListLink<E> next() {
        return next;
    }

    public ListLink<E> prev() {
        return prev;
    }

    public boolean isHead() {
        return sentinel;
    }

    /**
     * Inserts this entry right after the handle of {@code list}.
     */
    public void insertHead(ListLink<E> list) {
        checkInsertable(list);
        add(list, list.next);
    }

    /**
     * Inserts this entry right before the handle of {@code list}, i.e. at its tail.
     */
    public void insertTail(ListLink<E> list) {
        checkInsertable(list);
        add(list.prev, list);
    }

    /**
     * Unlinks this entry from whatever list holds it. The entry is left detached.
     */
    public void remove() {
        if (sentinel) throw new IllegalStateException("A list head cannot be removed");
        prev.next = next;
        next.prev = prev;
        prev = next = this;
    }

    public void moveToHead(ListLink<E> list) {
        remove();
        insertHead(list);
    }

    public boolean isEmpty() {
        return next == this;
    }

    /**
     * @return true if this entry currently sits in a list
     */
    public boolean isLinked() {
        return !sentinel && next != this;
    }

    /**
     * Moves every entry of this list to the head of {@code dest}, keeping their order.
     * This list is empty afterwards.
     */
    public void splice(ListLink<E> dest) {
        checkHeads(dest);
        if (isEmpty()) return;
        join(dest, dest.next);
    }

    /**
     * Moves every entry of this list to the tail of {@code dest}, keeping their order.
     * This list is empty afterwards.
     */
    public void spliceTail(ListLink<E> dest) {
        checkHeads(dest);
        if (isEmpty()) return;
        join(dest.prev, dest);
    }

    public E first() {
        return next.owner;
    }

    public E last() {
        return prev.owner;
    }

    /**
     * Counts the entries of this list. O(n).
     */
    public int size() {
        int count = 0;
        for (ListLink<E> cur = next; cur != this; cur = cur.next) {
            count++;
        }
        return count;
    }

    /**
     * Copies the owners of this list, in order. The copy stays valid while the
     * entries are relinked elsewhere.
     */
    public List<E> owners() {
        List<E> result = new ArrayList<>();
        for (ListLink<E> cur = next; cur != this; cur = cur.next) {
            result.add(cur.owner);
        }
        return result;
    }

    private void add(ListLink<E> before, ListLink<E> after) {
        after.prev = this;
        this.next = after;
        this.prev = before;
        before.next = this;
    }

    private void join(ListLink<E> before, ListLink<E> after) {
        ListLink<E> firstEntry = next;
        ListLink<E> lastEntry = prev;

        firstEntry.prev = before;
        before.next = firstEntry;
        lastEntry.next = after;
        after.prev = lastEntry;

        prev = next = this;
    }

    private void checkInsertable(ListLink<E> list) {
        if (sentinel) throw new IllegalStateException("A list head cannot be inserted into another list");
        if (!list.sentinel) throw new IllegalArgumentException("Target must be a list head");
        if (next != this) throw new IllegalStateException("Entry is already linked; remove it first");
    }

    private void checkHeads(ListLink<E> dest) {
        if (!sentinel || !dest.sentinel) throw new IllegalArgumentException("Splice works on list heads only");
        if (dest == this) throw new IllegalArgumentException("Cannot splice a list into itself");
    }

    @Override
    public String toString() {
        return sentinel ? "ListLink[head]" : "ListLink[" + owner + "]";
    }
}
