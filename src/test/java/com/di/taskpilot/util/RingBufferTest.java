package com.di.taskpilot.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RingBuffer Tests")
class RingBufferTest {

    @Test
    @DisplayName("Should keep insertion order while under capacity")
    void testToList_UnderCapacity() {
        RingBuffer<Integer> buffer = new RingBuffer<>(4);
        buffer.add(1);
        buffer.add(2);
        buffer.add(3);
        assertEquals(3, buffer.size());
        assertEquals(List.of(1, 2, 3), buffer.toList());
        assertEquals(3, buffer.latest());
    }

    @Test
    @DisplayName("Should overwrite the oldest entries once full")
    void testToList_Wraps() {
        RingBuffer<Integer> buffer = new RingBuffer<>(3);
        for (int i = 1; i <= 7; i++) buffer.add(i);
        assertEquals(3, buffer.size());
        assertEquals(List.of(5, 6, 7), buffer.toList());
        assertEquals(7, buffer.latest());
    }

    @Test
    @DisplayName("Should return the last n entries oldest first")
    void testLastN() {
        RingBuffer<Integer> buffer = new RingBuffer<>(5);
        for (int i = 1; i <= 8; i++) buffer.add(i);
        assertEquals(List.of(6, 7, 8), buffer.lastN(3));
        assertEquals(List.of(4, 5, 6, 7, 8), buffer.lastN(50));
        assertTrue(buffer.lastN(0).isEmpty());
    }

    @Test
    @DisplayName("Should be empty after clear")
    void testClear() {
        RingBuffer<String> buffer = new RingBuffer<>(2);
        buffer.add("a");
        buffer.clear();
        assertTrue(buffer.isEmpty());
        assertNull(buffer.latest());
        assertTrue(buffer.toList().isEmpty());
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void testConstructor_InvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RingBuffer<>(0));
    }
}
