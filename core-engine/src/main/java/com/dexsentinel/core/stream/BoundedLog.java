package com.dexsentinel.core.stream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Fixed-capacity, insertion-ordered log that evicts its oldest entry when
 * full.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Owners guard it with their
 * own lock.
 * </p>
 *
 * @param <T> entry type
 * @since 1.0.0
 */
public final class BoundedLog<T> {

    private final int capacity;
    private final Deque<T> entries;
    private long dropped;

    public BoundedLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Append an entry, evicting the oldest one if the log is full.
     *
     * @return {@code true} if an entry was evicted
     */
    public boolean append(T entry) {
        boolean evicted = false;
        if (entries.size() == capacity) {
            entries.pollFirst();
            dropped++;
            evicted = true;
        }
        entries.addLast(entry);
        return evicted;
    }

    /**
     * @param limit maximum number of entries to return; negative is treated
     *              as zero
     * @return up to {@code limit} most recent entries, newest first
     */
    public List<T> newestFirst(int limit) {
        return newestFirst(limit, entry -> true);
    }

    /**
     * @return up to {@code limit} most recent entries matching {@code filter},
     *         newest first
     */
    public List<T> newestFirst(int limit, Predicate<? super T> filter) {
        int max = Math.max(0, limit);
        List<T> result = new ArrayList<>(Math.min(max, entries.size()));
        Iterator<T> it = entries.descendingIterator();
        while (it.hasNext() && result.size() < max) {
            T entry = it.next();
            if (filter.test(entry)) {
                result.add(entry);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return the newest entry, or {@code null} if empty
     */
    public T newest() {
        return entries.peekLast();
    }

    /**
     * @return all entries, oldest first
     */
    public List<T> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * Remove every entry and reset the dropped counter.
     *
     * @return the number of entries removed
     */
    public int clear() {
        int removed = entries.size();
        entries.clear();
        dropped = 0;
        return removed;
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * @return number of entries evicted since creation or the last
     *         {@link #clear()}
     */
    public long dropped() {
        return dropped;
    }
}
