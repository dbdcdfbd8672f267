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
 * Snapshot of a hierarchy's shape and arena usage
 *
 * @param entries       live entries (leaves)
 * @param internalNodes internal nodes, always {@code entries - 1} for a non-empty hierarchy
 * @param height        nodes on the longest root-to-leaf path
 * @param arena         arena statistics
 * @author hal.hildebrand
 */
public record BVHStatistics(int entries, int internalNodes, int height, NodeArena.ArenaStats arena) {

    /**
     * Ratio of the actual height to the height of a perfectly balanced tree with the same number of entries. 1.0 is
     * optimal; an empty or single-entry hierarchy reports 1.0.
     */
    public double balanceRatio() {
        if (entries <= 1) {
            return 1.0;
        }
        double optimal = Math.ceil(Math.log(entries) / Math.log(2)) + 1;
        return height / optimal;
    }

    public int totalNodes() {
        return entries + internalNodes;
    }

    @Override
    public String toString() {
        return String.format("BVHStatistics[entries=%d, internal=%d, height=%d, balance=%.2f, capacity=%d]", entries,
                             internalNodes, height, balanceRatio(), arena.capacity());
    }
}
