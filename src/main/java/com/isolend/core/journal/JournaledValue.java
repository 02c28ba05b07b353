package com.isolend.core.journal;

/** Single journaled slot. Same immutability rule as {@link JournaledMap}. */
public class JournaledValue<V> {

    private final StateJournal journal;
    private V value;

    JournaledValue(StateJournal journal, V initial) {
        this.journal = journal;
        this.value = initial;
    }

    public V get() {
        return value;
    }

    public void set(V next) {
        V previous = value;
        value = next;
        journal.record(() -> value = previous);
    }
}
