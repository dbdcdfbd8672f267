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

import java.util.ArrayList;
import java.util.List;

import static com.hellblazer.sylvan.bvh.BVHNode.NONE;

/**
 * Structural validation of a {@link BoundingVolumeHierarchy}. Checks, for every node reachable from the root:
 * <ul>
 *   <li>each child names its parent, and the root has none</li>
 *   <li>internal nodes have exactly two children, leaves none</li>
 *   <li>internal bounds equal the union of the children's bounds</li>
 *   <li>internal subtree size is one more than the children's sum, leaves report zero</li>
 *   <li>the reachable leaves are exactly the keys in the key index, and no arena slot is leaked</li>
 * </ul>
 * Validation walks the whole tree under the read lock; it is meant for tests and debugging.
 *
 * @author hal.hildebrand
 */
public final class BVHValidator {

    private static final String BAD_BACK_POINTER = "Node %d names parent %d but is a child of %d";
    private static final String MISSING_CHILD    = "Internal node %d has left=%d, right=%d";
    private static final String LEAF_CHILDREN    = "Leaf %d has children left=%d, right=%d";
    private static final String BAD_BOUNDS       = "Node %d bounds %s != union of children %s";
    private static final String BAD_SUBTREE_SIZE = "Node %d subtree size %d, expected %d";
    private static final String UNINDEXED_LEAF   = "Leaf %d holding %s is indexed at %d";

    private BVHValidator() {
        throw new AssertionError("BVHValidator is a utility class and should not be instantiated");
    }

    /**
     * @throws AssertionError listing every violation found
     */
    public static void assertValid(BoundingVolumeHierarchy<?> tree) {
        var violations = findViolations(tree);
        if (!violations.isEmpty()) {
            throw new AssertionError("Invalid hierarchy:\n  " + String.join("\n  ", violations));
        }
    }

    /**
     * @return a description of every violated invariant; empty if the hierarchy is consistent
     */
    public static <T> List<String> findViolations(BoundingVolumeHierarchy<T> tree) {
        tree.lock().readLock().lock();
        try {
            return scan(tree);
        } finally {
            tree.lock().readLock().unlock();
        }
    }

    public static boolean isValid(BoundingVolumeHierarchy<?> tree) {
        return findViolations(tree).isEmpty();
    }

    private static <T> void checkChild(NodeArena<T> arena, int parentIndex, int childIndex, List<String> violations) {
        if (!arena.isAllocated(childIndex)) {
            violations.add(String.format("Node %d links to unallocated child %d", parentIndex, childIndex));
            return;
        }
        int named = arena.get(childIndex).parent;
        if (named != parentIndex) {
            violations.add(String.format(BAD_BACK_POINTER, childIndex, named, parentIndex));
        }
    }

    private static <T> List<String> scan(BoundingVolumeHierarchy<T> tree) {
        var violations = new ArrayList<String>();
        var arena = tree.arena();
        var keys = tree.keyIndex();
        int root = tree.rootIndex();

        if (root == NONE) {
            if (tree.leafCount() != 0 || keys.size() != 0 || arena.allocatedCount() != 0) {
                violations.add(String.format("Empty hierarchy reports %d entries, %d keys, %d allocated nodes",
                                             tree.leafCount(), keys.size(), arena.allocatedCount()));
            }
            return violations;
        }
        if (!arena.isAllocated(root)) {
            violations.add("Root " + root + " is not allocated");
            return violations;
        }
        if (arena.get(root).parent != NONE) {
            violations.add("Root " + root + " has parent " + arena.get(root).parent);
        }

        int leaves = 0;
        int reachable = 0;
        var stack = new IntStack();
        stack.push(root);
        while (!stack.isEmpty()) {
            int index = stack.pop();
            var node = arena.get(index);
            reachable++;
            if (reachable > arena.allocatedCount()) {
                violations.add("Cycle detected through node " + index);
                return violations;
            }

            if (node.leaf) {
                leaves++;
                if (node.left != NONE || node.right != NONE) {
                    violations.add(String.format(LEAF_CHILDREN, index, node.left, node.right));
                }
                if (node.subtreeSize != 0) {
                    violations.add(String.format(BAD_SUBTREE_SIZE, index, node.subtreeSize, 0));
                }
                int indexed = keys.indexOf(node.value);
                if (indexed != index) {
                    violations.add(String.format(UNINDEXED_LEAF, index, node.value, indexed));
                }
                continue;
            }

            if (node.left == NONE || node.right == NONE || node.left == node.right) {
                violations.add(String.format(MISSING_CHILD, index, node.left, node.right));
                continue;
            }
            checkChild(arena, index, node.left, violations);
            checkChild(arena, index, node.right, violations);
            if (!arena.isAllocated(node.left) || !arena.isAllocated(node.right)) {
                continue;
            }

            var left = arena.get(node.left);
            var right = arena.get(node.right);
            var union = left.bounds.union(right.bounds);
            if (!union.equals(node.bounds)) {
                violations.add(String.format(BAD_BOUNDS, index, node.bounds, union));
            }
            int expected = 1 + left.subtreeSize + right.subtreeSize;
            if (node.subtreeSize != expected) {
                violations.add(String.format(BAD_SUBTREE_SIZE, index, node.subtreeSize, expected));
            }
            stack.push(node.left);
            stack.push(node.right);
        }

        if (leaves != keys.size() || leaves != tree.leafCount()) {
            violations.add(String.format("Reachable leaves %d, indexed keys %d, entry count %d", leaves, keys.size(),
                                         tree.leafCount()));
        }
        if (reachable != arena.allocatedCount()) {
            violations.add(String.format("Reachable nodes %d, allocated nodes %d", reachable,
                                         arena.allocatedCount()));
        }
        return violations;
    }
}
