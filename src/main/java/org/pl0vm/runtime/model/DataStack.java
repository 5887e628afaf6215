package org.pl0vm.runtime.model;

import java.util.Arrays;

/**
 * A fixed-capacity stack of integer values.
 */
public final class DataStack {

    private final int[] values;
    private int size;

    /**
     * @param capacity The maximum number of values the stack holds.
     */
    public DataStack(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Data stack capacity must not be negative, got " + capacity);
        }
        this.values = new int[capacity];
    }

    public boolean isFull() {
        return size == values.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return values.length;
    }

    /**
     * @param value The value to push.
     * @throws IllegalStateException if the stack is full.
     */
    public void push(int value) {
        if (isFull()) {
            throw new IllegalStateException("Data stack overflow");
        }
        values[size++] = value;
    }

    /**
     * @return The removed top value.
     * @throws IllegalStateException if the stack is empty.
     */
    public int pop() {
        if (isEmpty()) {
            throw new IllegalStateException("Data stack underflow");
        }
        return values[--size];
    }

    /**
     * @return The top value without removing it.
     * @throws IllegalStateException if the stack is empty.
     */
    public int peek() {
        if (isEmpty()) {
            throw new IllegalStateException("Data stack is empty");
        }
        return values[size - 1];
    }

    /**
     * @return The contents from bottom to top.
     */
    public int[] toArray() {
        return Arrays.copyOf(values, size);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }
}
