package com.fibheap.x.list;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListLinkTest {

    @Test
    void newHeadIsEmpty() {
        ListLink<String> list = ListLink.head();

        assertThat(list.isEmpty()).isTrue();
        assertThat(list.size()).isZero();
        assertThat(list.first()).isNull();
        assertThat(list.last()).isNull();
    }

    @Test
    void insertHeadAndTailKeepPositions() {
        ListLink<String> list = ListLink.head();
        new ListLink<>("b").insertHead(list);
        new ListLink<>("a").insertHead(list);
        new ListLink<>("c").insertTail(list);

        assertThat(list.owners()).containsExactly("a", "b", "c");
        assertThat(list.first()).isEqualTo("a");
        assertThat(list.last()).isEqualTo("c");
        assertThat(list.size()).isEqualTo(3);
    }

    @Test
    void removeDetachesEntry() {
        ListLink<String> list = ListLink.head();
        ListLink<String> a = new ListLink<>("a");
        ListLink<String> b = new ListLink<>("b");
        a.insertTail(list);
        b.insertTail(list);

        a.remove();

        assertThat(a.isLinked()).isFalse();
        assertThat(b.isLinked()).isTrue();
        assertThat(list.owners()).containsExactly("b");

        b.remove();
        assertThat(list.isEmpty()).isTrue();
    }

    @Test
    void moveToHeadRelinksAcrossLists() {
        ListLink<String> source = ListLink.head();
        ListLink<String> target = ListLink.head();
        ListLink<String> a = new ListLink<>("a");
        ListLink<String> b = new ListLink<>("b");
        a.insertTail(source);
        b.insertTail(target);

        a.moveToHead(target);

        assertThat(source.isEmpty()).isTrue();
        assertThat(target.owners()).containsExactly("a", "b");

        b.moveToHead(target);
        assertThat(target.owners()).containsExactly("b", "a");
    }

    @Test
    void spliceTailAppendsAndEmptiesSource() {
        ListLink<String> dest = ListLink.head();
        ListLink<String> source = ListLink.head();
        new ListLink<>("a").insertTail(dest);
        new ListLink<>("b").insertTail(dest);
        new ListLink<>("c").insertTail(source);
        new ListLink<>("d").insertTail(source);

        source.spliceTail(dest);

        assertThat(dest.owners()).containsExactly("a", "b", "c", "d");
        assertThat(source.isEmpty()).isTrue();
        assertThat(dest.prev().owner()).isEqualTo("d");
    }

    @Test
    void spliceAttachesAtHead() {
        ListLink<String> dest = ListLink.head();
        ListLink<String> source = ListLink.head();
        new ListLink<>("c").insertTail(dest);
        new ListLink<>("a").insertTail(source);
        new ListLink<>("b").insertTail(source);

        source.splice(dest);

        assertThat(dest.owners()).containsExactly("a", "b", "c");
        assertThat(source.isEmpty()).isTrue();
    }

    @Test
    void splicingEmptyListIsNoOp() {
        ListLink<String> dest = ListLink.head();
        new ListLink<>("a").insertTail(dest);

        ListLink.<String>head().spliceTail(dest);

        assertThat(dest.owners()).containsExactly("a");
    }

    @Test
    void spliceIntoEmptyList() {
        ListLink<String> dest = ListLink.head();
        ListLink<String> source = ListLink.head();
        new ListLink<>("a").insertTail(source);

        source.spliceTail(dest);

        assertThat(dest.owners()).containsExactly("a");
        assertThat(dest.first()).isEqualTo("a");
        assertThat(dest.last()).isEqualTo("a");
    }

    @Test
    void rejectsMisuse() {
        ListLink<String> list = ListLink.head();
        ListLink<String> a = new ListLink<>("a");
        a.insertTail(list);

        assertThatThrownBy(() -> a.insertTail(list)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(list::remove).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new ListLink<>("b").insertTail(a)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> list.spliceTail(list)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ListLink<String>(null)).isInstanceOf(NullPointerException.class);
    }
}
