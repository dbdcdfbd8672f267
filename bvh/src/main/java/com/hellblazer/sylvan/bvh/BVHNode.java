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

/**
 * One slot of a {@link NodeArena}. Links to other nodes are arena indices, {@link #NONE} when absent. Slots are
 * recycled, so a node is only meaningful while {@link #allocated} is set.
 *
 * @author hal.hildebrand
 */
final class BVHNode<T> {
    static final int NONE = -1;

    T              value;
    BoundingVolume bounds;
    int            parent  = NONE;
    int            left    = NONE;
    int            right   = NONE;
    boolean        leaf;
    // internal nodes in the subtree rooted here, this one included; always 0 for leaves
    int            subtreeSize;
    boolean        allocated;

    boolean hasParent() {
        return parent != NONE;
    }

    void reset() {
        value = null;
        bounds = null;
        parent = NONE;
        left = NONE;
        right = NONE;
        leaf = false;
        subtreeSize = 0;
        allocated = false;
    }

    @Override
    public String toString() {
        if (!allocated) {
            return "BVHNode[free]";
        }
        return leaf ? "BVHNode[leaf value=" + value + ", parent=" + parent + ", bounds=" + bounds + "]"
                    : "BVHNode[internal parent=" + parent + ", left=" + left + ", right=" + right + ", subtree="
                    + subtreeSize + ", bounds=" + bounds + "]";
    }
}
