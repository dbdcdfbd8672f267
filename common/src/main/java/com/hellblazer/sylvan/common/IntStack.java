/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Sylvan.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.sylvan.common;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Unboxed LIFO stack of ints. Used for arena free lists and explicit traversal stacks where boxing every index into
 * an {@link Integer} would dominate the cost of the walk.
 *
 * @author hal.hildebrand
 */
public final class IntStack {

    public static final int DEFAULT_CAPACITY = 16;

    /** The backing store for the stack. */
    private int[] array;
    private int   size;

    public IntStack() {
        this(DEFAULT_CAPACITY);
    }

    public IntStack(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Initial capacity must be non-negative: " + initialCapacity);
        }
        array = new int[initialCapacity];
    }

    /**
     * Remove all elements, keeping the backing store
     */
    public void clear() {
        size = 0;
    }

    public boolean contains(int element) {
        for (int i = 0; i < size; i++) {
            if (array[i] == element) {
                return true;
            }
        }
        return false;
    }

    /**
     * Grow the backing store so at least {@code capacity} elements fit without further resizing
     */
    public void ensureCapacity(int capacity) {
        if (capacity > array.length) {
            array = Arrays.copyOf(array, capacity);
        }
    }

    public int capacity() {
        return array.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int peek() {
        if (size == 0) {
            throw new NoSuchElementException("Stack is empty");
        }
        return array[size - 1];
    }

    public int pop() {
        if (size == 0) {
            throw new NoSuchElementException("Stack is empty");
        }
        return array[--size];
    }

    public void push(int element) {
        if (size == array.length) {
            // Resize to 1.5x the size
            int length = ((size * 3) / 2) + 1;
            array = Arrays.copyOf(array, length);
        }
        array[size++] = element;
    }

    public int size() {
        return size;
    }

    /**
     * Copy of the live elements, bottom of the stack first
     */
    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("IntStack[");
        for (int i = 0; i < size; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(array[i]);
        }
        return sb.append(']').toString();
    }
}
