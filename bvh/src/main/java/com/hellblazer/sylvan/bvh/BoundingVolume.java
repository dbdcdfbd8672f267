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

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Objects;

/**
 * Immutable axis-aligned bounding volume. The min corner is never greater than the max corner on any axis, and every
 * coordinate is finite; construction rejects anything else, so a malformed volume never reaches a hierarchy.
 * <p>
 * {@link #volume()} is a cost proxy, the sum of the squared extents, rather than the geometric volume. It is monotonic
 * under {@link #union(BoundingVolume)}, which is all the insertion heuristic relies on.
 *
 * @author hal.hildebrand
 */
public final class BoundingVolume {
    private final Point3f min;
    private final Point3f max;
    private final double  volume;

    /**
     * Create bounds from min and max points
     *
     * @throws IllegalArgumentException if a coordinate is not finite or min exceeds max on any axis
     */
    public BoundingVolume(Point3f min, Point3f max) {
        Objects.requireNonNull(min, "min cannot be null");
        Objects.requireNonNull(max, "max cannot be null");
        validate(min, max);
        this.min = new Point3f(min);
        this.max = new Point3f(max);
        // widen before subtracting; a finite float span can exceed Float.MAX_VALUE
        double dx = (double) max.x - min.x;
        double dy = (double) max.y - min.y;
        double dz = (double) max.z - min.z;
        this.volume = dx * dx + dy * dy + dz * dz;
    }

    /**
     * Create a cube around a center point
     */
    public static BoundingVolume cube(Point3f center, float halfExtent) {
        return fromCenter(center, halfExtent, halfExtent, halfExtent);
    }

    /**
     * Create bounds from center and half-extents
     */
    public static BoundingVolume fromCenter(Point3f center, float halfWidth, float halfHeight, float halfDepth) {
        return new BoundingVolume(new Point3f(center.x - halfWidth, center.y - halfHeight, center.z - halfDepth),
                                  new Point3f(center.x + halfWidth, center.y + halfHeight, center.z + halfDepth));
    }

    public static BoundingVolume of(float minX, float minY, float minZ, float maxX, float maxY, float maxZ) {
        return new BoundingVolume(new Point3f(minX, minY, minZ), new Point3f(maxX, maxY, maxZ));
    }

    /**
     * Create point bounds (no extent)
     */
    public static BoundingVolume point(Point3f position) {
        return new BoundingVolume(position, position);
    }

    private static void validate(Point3f min, Point3f max) {
        if (!Float.isFinite(min.x) || !Float.isFinite(min.y) || !Float.isFinite(min.z) || !Float.isFinite(max.x)
        || !Float.isFinite(max.y) || !Float.isFinite(max.z)) {
            throw new IllegalArgumentException("Bounds must be finite: min=" + min + ", max=" + max);
        }
        if (min.x > max.x || min.y > max.y || min.z > max.z) {
            throw new IllegalArgumentException("Inverted bounds: min=" + min + ", max=" + max);
        }
    }

    /**
     * True if {@code other} lies entirely inside this volume, faces included
     */
    public boolean contains(BoundingVolume other) {
        return other.min.x >= min.x && other.max.x <= max.x && other.min.y >= min.y && other.max.y <= max.y
        && other.min.z >= min.z && other.max.z <= max.z;
    }

    /**
     * Growth of this volume's cost if it were enlarged to also enclose {@code other}. Zero when {@code other} is
     * already contained.
     */
    public double enlargementCost(BoundingVolume other) {
        if (contains(other)) {
            return 0.0;
        }
        return union(other).volume - volume;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingVolume that)) return false;
        return min.x == that.min.x && min.y == that.min.y && min.z == that.min.z && max.x == that.max.x
        && max.y == that.max.y && max.z == that.max.z;
    }

    /**
     * Get the center point of the bounds
     */
    public Point3f getCenter() {
        return new Point3f((min.x + max.x) / 2, (min.y + max.y) / 2, (min.z + max.z) / 2);
    }

    public Point3f getMax() {
        return new Point3f(max);
    }

    public float getMaxX() {
        return max.x;
    }

    public float getMaxY() {
        return max.y;
    }

    public float getMaxZ() {
        return max.z;
    }

    public Point3f getMin() {
        return new Point3f(min);
    }

    public float getMinX() {
        return min.x;
    }

    public float getMinY() {
        return min.y;
    }

    public float getMinZ() {
        return min.z;
    }

    /**
     * Extent along each axis
     */
    public Vector3f getSize() {
        return new Vector3f(max.x - min.x, max.y - min.y, max.z - min.z);
    }

    @Override
    public int hashCode() {
        // +0.0f normalizes -0.0f so hashCode agrees with the == comparison in equals
        return Objects.hash(min.x + 0.0f, min.y + 0.0f, min.z + 0.0f, max.x + 0.0f, max.y + 0.0f, max.z + 0.0f);
    }

    /**
     * Closed-interval overlap test; volumes that only touch on a face, edge or corner intersect
     */
    public boolean intersects(BoundingVolume other) {
        return !(max.x < other.min.x || min.x > other.max.x || max.y < other.min.y || min.y > other.max.y
                 || max.z < other.min.z || min.z > other.max.z);
    }

    @Override
    public String toString() {
        return String.format("BoundingVolume[min=(%.2f,%.2f,%.2f), max=(%.2f,%.2f,%.2f)]", min.x, min.y, min.z, max.x,
                             max.y, max.z);
    }

    /**
     * Tightest volume enclosing both this and {@code other}
     */
    public BoundingVolume union(BoundingVolume other) {
        if (contains(other)) {
            return this;
        }
        if (other.contains(this)) {
            return other;
        }
        return new BoundingVolume(new Point3f(Math.min(min.x, other.min.x), Math.min(min.y, other.min.y),
                                              Math.min(min.z, other.min.z)),
                                  new Point3f(Math.max(max.x, other.max.x), Math.max(max.y, other.max.y),
                                              Math.max(max.z, other.max.z)));
    }

    /**
     * Sum of squared extents
     */
    public double volume() {
        return volume;
    }
}
