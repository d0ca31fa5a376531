package com.di.taskpilot.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-capacity buffer with a write cursor; the oldest element is overwritten once full.
 * Not thread-safe: owners guard it with their own lock.
 */
public final class RingBuffer<T> {

    private final Object[] slots;
    private int cursor;
    private int size;

    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.slots = new Object[capacity];
    }

    public void add(T value) {
        slots[cursor] = value;
        cursor = (cursor + 1) % slots.length;
        if (size < slots.length) size++;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Most recently added element, or null when empty. */
    @SuppressWarnings("unchecked")
    public T latest() {
        if (size == 0) return null;
        return (T) slots[(cursor - 1 + slots.length) % slots.length];
    }

    /** Elements oldest first. */
    public List<T> toList() {
        return lastN(size);
    }

    /** Up to {@code n} most recent elements, oldest first. */
    @SuppressWarnings("unchecked")
    public List<T> lastN(int n) {
        int count = Math.max(0, Math.min(n, size));
        List<T> out = new ArrayList<>(count);
        int start = (cursor - count + slots.length) % slots.length;
        for (int i = 0; i < count; i++) {
            out.add((T) slots[(start + i) % slots.length]);
        }
        return out;
    }

    public void clear() {
        Arrays.fill(slots, null);
        cursor = 0;
        size = 0;
    }
}
