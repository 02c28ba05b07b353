package com.isolend.core.journal;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Map whose mutations are recorded in a {@link StateJournal}. Values must be immutable (or
 * replaced wholesale on change), otherwise in-place edits escape the undo log.
 */
public class JournaledMap<K, V> {

    private final StateJournal journal;
    private final Map<K, V> entries = new LinkedHashMap<>();

    JournaledMap(StateJournal journal) {
        this.journal = journal;
    }

    public V get(K key) {
        return entries.get(key);
    }

    public V getOrDefault(K key, V defaultValue) {
        return entries.getOrDefault(key, defaultValue);
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public void put(K key, V value) {
        boolean existed = entries.containsKey(key);
        V previous = entries.put(key, value);
        journal.record(() -> restore(key, existed, previous));
    }

    public void remove(K key) {
        if (!entries.containsKey(key)) {
            return;
        }
        V previous = entries.remove(key);
        journal.record(() -> entries.put(key, previous));
    }

    /** Replaces the value under {@code key} with {@code update(current)}; the key must exist. */
    public V update(K key, UnaryOperator<V> update) {
        V current = entries.get(key);
        if (current == null) {
            throw new IllegalStateException("No entry for key " + key);
        }
        V next = update.apply(current);
        put(key, next);
        return next;
    }

    public Set<K> keySet() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Collection<V> values() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    private void restore(K key, boolean existed, V previous) {
        if (existed) {
            entries.put(key, previous);
        } else {
            entries.remove(key);
        }
    }
}
