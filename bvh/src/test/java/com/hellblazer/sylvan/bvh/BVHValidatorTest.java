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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validator must notice each kind of corruption
 *
 * @author hal.hildebrand
 */
public class BVHValidatorTest {

    private BoundingVolumeHierarchy<Integer> bvh;

    @BeforeEach
    public void setUp() {
        bvh = new BoundingVolumeHierarchy<>();
        for (int i = 0; i < 8; i++) {
            bvh.insert(i, BoundingVolumeHierarchyTest.diagonal(i));
        }
    }

    @Test
    public void testConsistentTreeHasNoViolations() {
        assertTrue(BVHValidator.isValid(bvh));
        assertTrue(BVHValidator.isValid(new BoundingVolumeHierarchy<String>()));
    }

    @Test
    public void testDetectsWrongSubtreeSize() {
        bvh.arena().get(bvh.rootIndex()).subtreeSize = 42;

        var violations = BVHValidator.findViolations(bvh);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("subtree size 42"));
    }

    @Test
    public void testDetectsStaleBounds() {
        var root = bvh.arena().get(bvh.rootIndex());
        root.bounds = BoundingVolume.of(0, 0, 0, 1, 1, 1);

        assertFalse(BVHValidator.isValid(bvh));
        var failure = assertThrows(AssertionError.class, () -> BVHValidator.assertValid(bvh));
        assertTrue(failure.getMessage().contains("union of children"));
    }

    @Test
    public void testDetectsBrokenBackPointer() {
        var root = bvh.arena().get(bvh.rootIndex());
        bvh.arena().get(root.left).parent = root.right;

        assertTrue(BVHValidator.findViolations(bvh).stream().anyMatch(v -> v.contains("names parent")));
    }

    @Test
    public void testDetectsUnindexedLeaf() {
        int leaf = bvh.keyIndex().indexOf(3);
        bvh.keyIndex().remove(3);

        var violations = BVHValidator.findViolations(bvh);
        assertTrue(violations.stream().anyMatch(v -> v.contains("Leaf " + leaf)));
        assertTrue(violations.stream().anyMatch(v -> v.contains("indexed keys 7")));
    }

    @Test
    public void testDetectsLeakedSlot() {
        bvh.arena().allocateInternal(BoundingVolume.of(0, 0, 0, 1, 1, 1));

        assertTrue(BVHValidator.findViolations(bvh).stream().anyMatch(v -> v.contains("allocated nodes")));
    }
}
