package com.github.rudygunawan.memo.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Memoized results ordered from least to most recently used.
 *
 * <p>Entries live in parallel arrays indexed by slot. Slot {@code 0} is the root sentinel of a
 * circular doubly linked list threaded through {@code prev} and {@code next}: {@code next[ROOT]} is
 * the least recently used entry and {@code prev[ROOT]} the most recently used one. The list is empty
 * exactly when both point back at the root. A hash map from key to slot gives O(1) lookup, and slots
 * released by {@link #remove(Object)} are kept on a free list threaded through {@code next}.
 *
 * <p>Not thread-safe; the owning cache guards every call with its lock.
 *
 * @param <V> the type of memoized results
 */
final class RecencyStore<V> {

    static final int ABSENT = -1;

    private static final int ROOT = 0;
    private static final int NIL = -1;
    private static final int MINIMUM_CAPACITY = 4;

    private final int initialCapacity;
    private final Map<Object, Integer> index;

    private Object[] keys;
    private Object[] results;
    private int[] prev;
    private int[] next;

    // slots handed out so far, the root included
    private int allocated;
    private int freeHead;

    RecencyStore(int initialCapacity) {
        this.initialCapacity = Math.max(MINIMUM_CAPACITY, initialCapacity + 1);
        this.index = new HashMap<>();
        reset();
    }

    int size() {
        return index.size();
    }

    boolean contains(Object key) {
        return index.containsKey(key);
    }

    /**
     * Moves the entry for {@code key} to the most recently used position.
     *
     * @return the entry's slot, or {@link #ABSENT} if there is no entry (the order is then untouched)
     */
    int lookupAndPromote(Object key) {
        Integer slot = index.get(key);
        if (slot == null) {
            return ABSENT;
        }
        int s = slot;
        unlink(s);
        linkLast(s);
        return s;
    }

    @SuppressWarnings("unchecked")
    V resultAt(int slot) {
        return (V) results[slot];
    }

    /**
     * Adds a new entry at the most recently used position. The key must not be present.
     */
    void insert(Object key, V result) {
        int slot = allocate();
        keys[slot] = key;
        results[slot] = result;
        linkLast(slot);
        index.put(key, slot);
    }

    /**
     * Replaces the least recently used entry with a new one, reusing its slot. The store must not
     * be empty and the key must not be present.
     *
     * <p>The evicted key and result are returned rather than released here, so that whatever the
     * caller does with them (removal listeners) only happens once the map and the list agree again.
     * The map insertion of the new key comes last for the same reason: {@code hashCode} and
     * {@code equals} of the key are caller code.
     *
     * @return the evicted key and result
     */
    RemovedEntry<V> evictAndReuse(Object key, V result) {
        int slot = next[ROOT];
        Object oldKey = keys[slot];
        @SuppressWarnings("unchecked")
        V oldResult = (V) results[slot];

        index.remove(oldKey);
        keys[slot] = key;
        results[slot] = result;
        unlink(slot);
        linkLast(slot);
        index.put(key, slot);

        return new RemovedEntry<>(oldKey, oldResult);
    }

    /**
     * Removes the entry for {@code key} and puts its slot on the free list.
     *
     * @return the removed key and result, or {@code null} if there was no entry
     */
    RemovedEntry<V> remove(Object key) {
        Integer slot = index.remove(key);
        if (slot == null) {
            return null;
        }
        int s = slot;
        @SuppressWarnings("unchecked")
        RemovedEntry<V> removed = new RemovedEntry<>(keys[s], (V) results[s]);
        unlink(s);
        keys[s] = null;
        results[s] = null;
        prev[s] = NIL;
        next[s] = freeHead;
        freeHead = s;
        return removed;
    }

    /**
     * Empties the store and releases its arrays.
     *
     * @param collect whether to return the dropped entries
     * @return the dropped entries from least to most recently used, or an empty list if not collected
     */
    List<RemovedEntry<V>> clear(boolean collect) {
        List<RemovedEntry<V>> dropped = collect ? snapshot() : List.of();
        index.clear();
        reset();
        return dropped;
    }

    /**
     * Returns the keys from least to most recently used.
     */
    List<Object> keysByRecency() {
        List<Object> ordered = new ArrayList<>(index.size());
        for (int s = next[ROOT]; s != ROOT; s = next[s]) {
            ordered.add(keys[s]);
        }
        return ordered;
    }

    /**
     * Walks the list in both directions and checks it against the map.
     *
     * @throws IllegalStateException if the list and the map disagree
     */
    void checkConsistency() {
        int count = 0;
        for (int s = next[ROOT]; s != ROOT; s = next[s]) {
            if (prev[next[s]] != s) {
                throw new IllegalStateException("broken link after slot " + s);
            }
            Integer mapped = index.get(keys[s]);
            if (mapped == null || mapped != s) {
                throw new IllegalStateException("slot " + s + " is not mapped by its key " + keys[s]);
            }
            if (++count > index.size()) {
                throw new IllegalStateException("list is longer than the map");
            }
        }
        if (count != index.size()) {
            throw new IllegalStateException("list holds " + count + " entries, map holds " + index.size());
        }
        if (count == 0 && (next[ROOT] != ROOT || prev[ROOT] != ROOT)) {
            throw new IllegalStateException("empty store with a non-circular root");
        }
    }

    private List<RemovedEntry<V>> snapshot() {
        List<RemovedEntry<V>> entries = new ArrayList<>(index.size());
        for (int s = next[ROOT]; s != ROOT; s = next[s]) {
            entries.add(new RemovedEntry<>(keys[s], resultAt(s)));
        }
        return entries;
    }

    private int allocate() {
        if (freeHead != NIL) {
            int slot = freeHead;
            freeHead = next[slot];
            return slot;
        }
        if (allocated == keys.length) {
            int capacity = keys.length * 2;
            keys = Arrays.copyOf(keys, capacity);
            results = Arrays.copyOf(results, capacity);
            prev = Arrays.copyOf(prev, capacity);
            next = Arrays.copyOf(next, capacity);
        }
        return allocated++;
    }

    private void unlink(int slot) {
        int before = prev[slot];
        int after = next[slot];
        next[before] = after;
        prev[after] = before;
    }

    private void linkLast(int slot) {
        int last = prev[ROOT];
        next[last] = slot;
        prev[slot] = last;
        next[slot] = ROOT;
        prev[ROOT] = slot;
    }

    private void reset() {
        keys = new Object[initialCapacity];
        results = new Object[initialCapacity];
        prev = new int[initialCapacity];
        next = new int[initialCapacity];
        prev[ROOT] = ROOT;
        next[ROOT] = ROOT;
        allocated = 1;
        freeHead = NIL;
    }
}
