package com.isolend.position;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-capacity set backed by an array. {@link #insert} appends, {@link #remove} swaps the
 * removed slot with the last element, so both are O(1) after the membership scan and the
 * capacity bounds every iteration over the set.
 *
 * <p>Instances are mutable; {@link Position} copies them before every change so journaled
 * snapshots are never edited in place.
 */
public final class BoundedSet {

    private final String[] elements;
    private int size;

    public BoundedSet(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.elements = new String[capacity];
    }

    private BoundedSet(String[] elements, int size) {
        this.elements = elements;
        this.size = size;
    }

    /**
     * Adds {@code element} unless already present.
     *
     * @return false when the set is full and the element is not a member
     */
    public boolean insert(String element) {
        if (contains(element)) {
            return true;
        }
        if (size == elements.length) {
            return false;
        }
        elements[size++] = element;
        return true;
    }

    /** Removes {@code element} if present; the last element takes its slot. */
    public void remove(String element) {
        int index = indexOf(element);
        if (index < 0) {
            return;
        }
        size--;
        elements[index] = elements[size];
        elements[size] = null;
    }

    public boolean contains(String element) {
        return indexOf(element) >= 0;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return elements.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == elements.length;
    }

    /** Snapshot of the members in slot order. */
    public List<String> elements() {
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(elements).subList(0, size)));
    }

    public BoundedSet copy() {
        return new BoundedSet(Arrays.copyOf(elements, elements.length), size);
    }

    private int indexOf(String element) {
        for (int i = 0; i < size; i++) {
            if (elements[i].equals(element)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return elements().toString();
    }
}
