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
 * Tuning for a {@link BoundingVolumeHierarchy}.
 *
 * @author hal.hildebrand
 */
public class BVHConfig {
    public static final int    DEFAULT_INITIAL_CAPACITY  = 16;
    public static final int    DEFAULT_BALANCE_THRESHOLD = 2;
    public static final double DEFAULT_COST_TOLERANCE    = 1e-3;

    private int    initialCapacity  = DEFAULT_INITIAL_CAPACITY;
    private int    balanceThreshold = DEFAULT_BALANCE_THRESHOLD;
    private double costTolerance    = DEFAULT_COST_TOLERANCE;

    public static BVHConfig defaultConfig() {
        return new BVHConfig();
    }

    /**
     * Largest difference in child subtree sizes for which the insertion descent still compares costs. Beyond it the
     * descent always enters the smaller child.
     */
    public int getBalanceThreshold() {
        return balanceThreshold;
    }

    /**
     * Relative difference below which two insertion costs count as a tie, broken toward the smaller subtree
     */
    public double getCostTolerance() {
        return costTolerance;
    }

    /**
     * Node slots reserved up front; rounded up to a power of two by the arena
     */
    public int getInitialCapacity() {
        return initialCapacity;
    }

    public BVHConfig withBalanceThreshold(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Balance threshold must be non-negative: " + threshold);
        }
        this.balanceThreshold = threshold;
        return this;
    }

    public BVHConfig withCostTolerance(double tolerance) {
        if (!(tolerance >= 0.0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Cost tolerance must be a finite non-negative number: " + tolerance);
        }
        this.costTolerance = tolerance;
        return this;
    }

    public BVHConfig withInitialCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Initial capacity must be positive: " + capacity);
        }
        this.initialCapacity = capacity;
        return this;
    }

    @Override
    public String toString() {
        return "BVHConfig[initialCapacity=" + initialCapacity + ", balanceThreshold=" + balanceThreshold
        + ", costTolerance=" + costTolerance + "]";
    }
}
