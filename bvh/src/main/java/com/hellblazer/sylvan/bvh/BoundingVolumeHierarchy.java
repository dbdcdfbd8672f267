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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

import static com.hellblazer.sylvan.bvh.BVHNode.NONE;

/**
 * Dynamic bounding volume hierarchy mapping keys to axis-aligned {@link BoundingVolume}s. Entries are inserted,
 * removed and relocated one at a time; the tree is never rebuilt.
 *
 * <p>Nodes live in a {@link NodeArena} and link to each other by slot index. Every internal node has exactly two
 * children, its bounds are the union of theirs, and its subtree size is one more than the sum of its children's. A
 * {@link KeyIndex} maps each key to its leaf so removal and relocation by key cost O(1) plus the walk back up to the
 * root.</p>
 *
 * <p><b>Insertion</b> descends from the root to a sibling leaf. At each internal node the descent enters the child
 * with the smaller subtree when the two subtree sizes differ by more than
 * {@link BVHConfig#getBalanceThreshold()}. Otherwise it enters the child whose bounds grow least to admit the new
 * volume, and when the two costs are within {@link BVHConfig#getCostTolerance()} of each other it again prefers the
 * smaller subtree. The size guard keeps the depth logarithmic even when volumes arrive in sorted order. Both
 * settings are copied out of the {@link BVHConfig} at construction.</p>
 *
 * <p><b>Thread safety</b> follows a single read-write lock:</p>
 * <ul>
 *   <li><b>Write lock</b> for insert, remove, update, clear and capacity changes</li>
 *   <li><b>Read lock</b> for queries, lookups and statistics</li>
 * </ul>
 * <p>Concurrent callers therefore observe some serial order of the operations. Each mutating operation validates its
 * arguments and the presence of its key before touching the tree, so a failed call leaves no trace.</p>
 *
 * @param <T> the key type, also the value reported by queries
 * @author hal.hildebrand
 */
public class BoundingVolumeHierarchy<T> {
    private static final Logger log                  = LoggerFactory.getLogger(BoundingVolumeHierarchy.class);
    // a depth-first walk holds at most one pending sibling per level
    private static final int    QUERY_STACK_CAPACITY = 64;

    // copied from the BVHConfig at construction
    private final int           balanceThreshold;
    private final double        costTolerance;
    private final NodeArena<T>  arena;
    private final KeyIndex<T>   keys;
    // Read-write lock for thread safety
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private       int           rootIndex = NONE;
    private       int           leafCount;

    public BoundingVolumeHierarchy() {
        this(BVHConfig.defaultConfig());
    }

    public BoundingVolumeHierarchy(int initialCapacity) {
        this(BVHConfig.defaultConfig().withInitialCapacity(initialCapacity));
    }

    public BoundingVolumeHierarchy(BVHConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.balanceThreshold = config.getBalanceThreshold();
        this.costTolerance = config.getCostTolerance();
        this.arena = new NodeArena<>(config.getInitialCapacity());
        this.keys = new KeyIndex<>(config.getInitialCapacity() / 2);
    }

    /**
     * Remove every entry. Node slots are released for reuse, not deallocated, so capacity is retained.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            clearInternal();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(T key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.readLock().lock();
        try {
            return keys.contains(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reserve node slots for at least {@code entries} entries. A hierarchy of n entries uses 2n - 1 nodes.
     */
    public void ensureCapacity(int entries) {
        if (entries < 0) {
            throw new IllegalArgumentException("Entry count must be non-negative: " + entries);
        }
        lock.writeLock().lock();
        try {
            arena.ensureCapacity(Math.max(1, 2 * entries - 1));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Apply {@code action} to the key of every entry whose bounds intersect {@code volume}. Matches are collected
     * under the read lock and the action runs after it is released, so the action may modify this hierarchy.
     */
    public void forEachIntersecting(BoundingVolume volume, Consumer<? super T> action) {
        Objects.requireNonNull(action, "action cannot be null");
        query(volume).forEach(action);
    }

    /**
     * @return the stored bounds of {@code key}, or empty if the key has no entry
     */
    public Optional<BoundingVolume> getBounds(T key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.readLock().lock();
        try {
            int index = keys.indexOf(key);
            return index == KeyIndex.NOT_FOUND ? Optional.empty() : Optional.of(arena.get(index).bounds);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the bounds enclosing every entry, or empty if there are none
     */
    public Optional<BoundingVolume> getRootBounds() {
        lock.readLock().lock();
        try {
            return rootIndex == NONE ? Optional.empty() : Optional.of(arena.get(rootIndex).bounds);
        } finally {
            lock.readLock().unlock();
        }
    }

    public BVHStatistics getStatistics() {
        lock.readLock().lock();
        try {
            int internal = rootIndex == NONE ? 0 : arena.get(rootIndex).subtreeSize;
            return new BVHStatistics(leafCount, internal, heightInternal(), arena.getStats());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of nodes on the longest path from the root to a leaf; 0 when empty
     */
    public int height() {
        lock.readLock().lock();
        try {
            return heightInternal();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Insert {@code key} with {@code bounds}. If the key already has an entry, that entry is discarded first.
     */
    public void insert(T key, BoundingVolume bounds) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(bounds, "bounds cannot be null");

        lock.writeLock().lock();
        try {
            int existing = keys.indexOf(key);
            if (existing != KeyIndex.NOT_FOUND) {
                log.trace("Replacing existing entry for {}", key);
                removeLeaf(key, existing);
            }
            insertLeaf(key, bounds);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Append the key of every entry whose bounds intersect {@code volume} to {@code results}. Entries that merely
     * touch the volume are included.
     *
     * @return the number of keys appended
     */
    public int query(BoundingVolume volume, Collection<? super T> results) {
        Objects.requireNonNull(volume, "volume cannot be null");
        Objects.requireNonNull(results, "results cannot be null");

        lock.readLock().lock();
        try {
            if (rootIndex == NONE) {
                return 0;
            }
            int found = 0;
            var stack = new IntStack(QUERY_STACK_CAPACITY);
            stack.push(rootIndex);
            while (!stack.isEmpty()) {
                var node = arena.get(stack.pop());
                if (!node.bounds.intersects(volume)) {
                    continue;
                }
                if (node.leaf) {
                    results.add(node.value);
                    found++;
                } else {
                    stack.push(node.right);
                    stack.push(node.left);
                }
            }
            return found;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the keys of every entry whose bounds intersect {@code volume}
     */
    public List<T> query(BoundingVolume volume) {
        var results = new ArrayList<T>();
        query(volume, results);
        return results;
    }

    /**
     * Remove the entry for {@code key}
     *
     * @throws KeyNotFoundException if the key has no entry
     */
    public void remove(T key) {
        if (!tryRemove(key)) {
            throw new KeyNotFoundException(key);
        }
    }

    /**
     * Number of entries
     */
    public int size() {
        lock.readLock().lock();
        try {
            return leafCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "BoundingVolumeHierarchy[size=" + size() + ", height=" + height() + "]";
    }

    /**
     * Remove the entry for {@code key} if there is one
     *
     * @return true if an entry was removed
     */
    public boolean tryRemove(T key) {
        Objects.requireNonNull(key, "key cannot be null");

        lock.writeLock().lock();
        try {
            int index = keys.indexOf(key);
            if (index == KeyIndex.NOT_FOUND) {
                return false;
            }
            removeLeaf(key, index);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Move the entry for {@code key} to {@code newBounds}. The entry is taken out and inserted again from the root,
     * so its position in the tree is as good as for a fresh insertion no matter how far it moved.
     *
     * @throws KeyNotFoundException if the key has no entry
     */
    public void updateEntryBounds(T key, BoundingVolume newBounds) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(newBounds, "bounds cannot be null");

        lock.writeLock().lock();
        try {
            int index = keys.indexOf(key);
            if (index == KeyIndex.NOT_FOUND) {
                throw new KeyNotFoundException(key);
            }
            if (arena.get(index).bounds.equals(newBounds)) {
                return;
            }
            removeLeaf(key, index);
            insertLeaf(key, newBounds);
        } finally {
            lock.writeLock().unlock();
        }
    }

    NodeArena<T> arena() {
        return arena;
    }

    int leafCount() {
        return leafCount;
    }

    KeyIndex<T> keyIndex() {
        return keys;
    }

    ReadWriteLock lock() {
        return lock;
    }

    int rootIndex() {
        return rootIndex;
    }

    /**
     * Pick the child of {@code node} to descend into for a new entry with {@code bounds}
     */
    private int chooseChild(BVHNode<T> node, BoundingVolume bounds) {
        var left = arena.get(node.left);
        var right = arena.get(node.right);

        if (Math.abs(left.subtreeSize - right.subtreeSize) > balanceThreshold) {
            return left.subtreeSize < right.subtreeSize ? node.left : node.right;
        }

        double leftCost = left.bounds.enlargementCost(bounds);
        double rightCost = right.bounds.enlargementCost(bounds);
        if (isTie(leftCost, rightCost)) {
            return right.subtreeSize < left.subtreeSize ? node.right : node.left;
        }
        return leftCost < rightCost ? node.left : node.right;
    }

    private void clearInternal() {
        if (rootIndex == NONE && arena.allocatedCount() == 0) {
            return;
        }
        arena.clear();
        keys.clear();
        rootIndex = NONE;
        leafCount = 0;
        log.debug("Hierarchy cleared");
    }

    private int heightInternal() {
        if (rootIndex == NONE) {
            return 0;
        }
        int height = 0;
        var nodes = new IntStack();
        var depths = new IntStack();
        nodes.push(rootIndex);
        depths.push(1);
        while (!nodes.isEmpty()) {
            var node = arena.get(nodes.pop());
            int depth = depths.pop();
            if (node.leaf) {
                height = Math.max(height, depth);
            } else {
                nodes.push(node.left);
                depths.push(depth + 1);
                nodes.push(node.right);
                depths.push(depth + 1);
            }
        }
        return height;
    }

    private void insertLeaf(T key, BoundingVolume bounds) {
        int leafIndex = arena.allocateLeaf(key, bounds);
        keys.set(key, leafIndex);
        leafCount++;

        if (rootIndex == NONE) {
            rootIndex = leafIndex;
            return;
        }

        int siblingIndex = rootIndex;
        var sibling = arena.get(siblingIndex);
        while (!sibling.leaf) {
            siblingIndex = chooseChild(sibling, bounds);
            sibling = arena.get(siblingIndex);
        }

        int oldParent = sibling.parent;
        int parentIndex = arena.allocateInternal(sibling.bounds.union(bounds));
        var parent = arena.get(parentIndex);
        parent.parent = oldParent;
        parent.left = siblingIndex;
        parent.right = leafIndex;
        parent.subtreeSize = 1;
        sibling.parent = parentIndex;
        arena.get(leafIndex).parent = parentIndex;

        if (oldParent == NONE) {
            rootIndex = parentIndex;
        } else {
            replaceChild(oldParent, siblingIndex, parentIndex);
            refit(oldParent);
        }
        log.trace("Inserted {} at leaf {} beside {}", key, leafIndex, siblingIndex);
    }

    private boolean isTie(double a, double b) {
        return Math.abs(a - b) <= costTolerance * Math.max(Math.abs(a), Math.abs(b));
    }

    /**
     * Recompute bounds and subtree size of {@code index} and every ancestor. Sizes change all the way up, so the walk
     * always reaches the root.
     */
    private void refit(int index) {
        while (index != NONE) {
            var node = arena.get(index);
            var left = arena.get(node.left);
            var right = arena.get(node.right);
            node.bounds = left.bounds.union(right.bounds);
            node.subtreeSize = 1 + left.subtreeSize + right.subtreeSize;
            index = node.parent;
        }
    }

    private void removeLeaf(T key, int leafIndex) {
        var leaf = arena.get(leafIndex);
        if (!leaf.hasParent()) {
            clearInternal();
            log.trace("Removed {}, hierarchy now empty", key);
            return;
        }

        int parentIndex = leaf.parent;
        var parent = arena.get(parentIndex);
        int siblingIndex = parent.left == leafIndex ? parent.right : parent.left;
        int grandparentIndex = parent.parent;

        arena.get(siblingIndex).parent = grandparentIndex;
        if (grandparentIndex == NONE) {
            rootIndex = siblingIndex;
        } else {
            replaceChild(grandparentIndex, parentIndex, siblingIndex);
        }

        keys.remove(key);
        arena.free(leafIndex);
        arena.free(parentIndex);
        leafCount--;
        refit(grandparentIndex);
        log.trace("Removed {} from leaf {}", key, leafIndex);
    }

    private void replaceChild(int parentIndex, int oldChild, int newChild) {
        var parent = arena.get(parentIndex);
        if (parent.left == oldChild) {
            parent.left = newChild;
        } else if (parent.right == oldChild) {
            parent.right = newChild;
        } else {
            throw new IllegalStateException("Node " + oldChild + " is not a child of " + parentIndex);
        }
    }
}
