package com.isolend.unit.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.isolend.position.BoundedSet;
import org.junit.jupiter.api.Test;

class BoundedSetTest {

    @Test
    void insertIgnoresDuplicatesAndRefusesWhenFull() {
        BoundedSet set = new BoundedSet(2);

        assertThat(set.insert("a")).isTrue();
        assertThat(set.insert("a")).isTrue();
        assertThat(set.insert("b")).isTrue();
        assertThat(set.insert("c")).isFalse();

        assertThat(set.elements()).containsExactly("a", "b");
        assertThat(set.isFull()).isTrue();
    }

    @Test
    void removeMovesLastElementIntoFreedSlot() {
        BoundedSet set = new BoundedSet(3);
        set.insert("a");
        set.insert("b");
        set.insert("c");

        set.remove("a");
        set.remove("missing");

        assertThat(set.elements()).containsExactly("c", "b");
        assertThat(set.size()).isEqualTo(2);
    }

    @Test
    void copyIsIndependent() {
        BoundedSet original = new BoundedSet(2);
        original.insert("a");

        BoundedSet copy = original.copy();
        copy.insert("b");
        copy.remove("a");

        assertThat(original.elements()).containsExactly("a");
        assertThat(copy.elements()).containsExactly("b");
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new BoundedSet(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
