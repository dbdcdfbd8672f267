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
package com.hellblazer.sylvan.bvh;

import com.hellblazer.sylvan.common.IntStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Index-stable pool of {@link BVHNode} slots. Nodes refer to each other only by slot index, so an index handed out by
 * {@link #allocateLeaf} or {@link #allocateInternal} stays valid until that slot is {@link #free freed}: growth copies
 * slot references into a larger table and never moves a node to a different index.
 * <p>
 * Freed slots are kept on a LIFO free list and handed out again before any never-used slot. Misuse (an index outside
 * the table, freeing a free slot, reading a free slot) means the hierarchy's links are already corrupt, so it fails
 * fast with an unchecked exception instead of being tolerated.
 * <p>
 * Not thread safe. {@link BoundingVolumeHierarchy} only touches its arena while holding its write lock (or read lock
 * for pure reads).
 *
 * @param <T> the type of value stored in leaf nodes
 * @author hal.hildebrand
 */
public class NodeArena<T> {
    private static final Logger log = LoggerFactory.getLogger(NodeArena.class);

    private final IntStack     freeIndices = new IntStack();
    private       BVHNode<T>[] slots;
    // slots at or above this index have never been handed out since construction or the last clear
    private       int          highWaterMark;
    private       int          allocatedCount;
    // Statistics
    private       long         allocations;
    private       long         reuses;
    private       long         frees;
    private       long         growths;
    private       int          peakAllocated;

    public NodeArena(int initialCapacity) {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
        }
        slots = newSlots(nextPowerOfTwo(initialCapacity));
        populate(0);
    }

    static int nextPowerOfTwo(int value) {
        if (value <= 1) {
            return 1;
        }
        int highest = Integer.highestOneBit(value - 1) << 1;
        if (highest <= 0) {
            throw new IllegalArgumentException("Capacity too large: " + value);
        }
        return highest;
    }

    @SuppressWarnings("unchecked")
    private static <T> BVHNode<T>[] newSlots(int capacity) {
        return (BVHNode<T>[]) new BVHNode[capacity];
    }

    /**
     * Allocate an internal node with the given bounds and no links
     *
     * @return the index of the node
     */
    public int allocateInternal(BoundingVolume bounds) {
        int index = allocate();
        var node = slots[index];
        node.bounds = bounds;
        node.leaf = false;
        return index;
    }

    /**
     * Allocate a leaf node holding {@code value} within {@code bounds}
     *
     * @return the index of the node
     */
    public int allocateLeaf(T value, BoundingVolume bounds) {
        int index = allocate();
        var node = slots[index];
        node.value = value;
        node.bounds = bounds;
        node.leaf = true;
        return index;
    }

    public int allocatedCount() {
        return allocatedCount;
    }

    public int capacity() {
        return slots.length;
    }

    /**
     * Logically free every slot. The table keeps its current capacity.
     */
    public void clear() {
        for (int i = 0; i < highWaterMark; i++) {
            slots[i].reset();
        }
        freeIndices.clear();
        highWaterMark = 0;
        allocatedCount = 0;
        log.debug("Arena cleared, capacity {} retained", slots.length);
    }

    /**
     * Grow the table so that at least {@code capacity} nodes fit without further growth
     */
    public void ensureCapacity(int capacity) {
        if (capacity > slots.length) {
            resize(nextPowerOfTwo(capacity));
        }
    }

    /**
     * Return a slot to the arena. The slot is reset to its sentinel state and becomes the next one handed out.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside the table
     * @throws IllegalStateException     if the slot is already free
     */
    public void free(int index) {
        Objects.checkIndex(index, slots.length);
        var node = slots[index];
        if (!node.allocated) {
            throw new IllegalStateException("Double free of arena slot " + index);
        }
        node.reset();
        freeIndices.push(index);
        allocatedCount--;
        frees++;
    }

    /**
     * @throws IndexOutOfBoundsException if {@code index} is outside the table
     * @throws IllegalStateException     if the slot is free
     */
    BVHNode<T> get(int index) {
        Objects.checkIndex(index, slots.length);
        var node = slots[index];
        if (!node.allocated) {
            throw new IllegalStateException("Arena slot " + index + " is not allocated");
        }
        return node;
    }

    public ArenaStats getStats() {
        return new ArenaStats(allocations, reuses, frees, growths, allocatedCount, peakAllocated, slots.length);
    }

    /**
     * One past the highest slot index handed out since construction or the last {@link #clear()}
     */
    public int highWaterMark() {
        return highWaterMark;
    }

    public boolean isAllocated(int index) {
        return index >= 0 && index < slots.length && slots[index].allocated;
    }

    private int allocate() {
        int index;
        if (!freeIndices.isEmpty()) {
            index = freeIndices.pop();
            reuses++;
        } else {
            if (highWaterMark == slots.length) {
                resize(slots.length * 2);
            }
            index = highWaterMark++;
        }
        var node = slots[index];
        node.reset();
        node.allocated = true;
        allocations++;
        allocatedCount++;
        if (allocatedCount > peakAllocated) {
            peakAllocated = allocatedCount;
        }
        return index;
    }

    private void populate(int from) {
        for (int i = from; i < slots.length; i++) {
            slots[i] = new BVHNode<>();
        }
    }

    private void resize(int newCapacity) {
        if (newCapacity <= 0) {
            throw new IllegalStateException("Arena capacity overflow at " + slots.length + " slots");
        }
        int oldCapacity = slots.length;
        slots = Arrays.copyOf(slots, newCapacity);
        populate(oldCapacity);
        growths++;
        log.debug("Arena grown from {} to {} slots", oldCapacity, newCapacity);
    }

    /**
     * Arena statistics snapshot
     *
     * @param allocations   slots handed out over the arena's lifetime
     * @param reuses        allocations served from the free list
     * @param frees         slots returned to the arena
     * @param growths       number of times the table was enlarged
     * @param allocated     slots currently in use
     * @param peakAllocated largest number of slots simultaneously in use
     * @param capacity      current table size
     */
    public record ArenaStats(long allocations, long reuses, long frees, long growths, int allocated, int peakAllocated,
                             int capacity) {

        public double getReuseRate() {
            return allocations > 0 ? (double) reuses / allocations : 0.0;
        }

        public double getUtilization() {
            return capacity > 0 ? (double) allocated / capacity : 0.0;
        }
    }
}
