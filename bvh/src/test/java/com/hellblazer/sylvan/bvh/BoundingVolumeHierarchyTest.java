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

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class BoundingVolumeHierarchyTest {

    private BoundingVolumeHierarchy<Integer> bvh;

    static BoundingVolume diagonal(int i) {
        return BoundingVolume.of(i, i, i, i + 1, i + 1, i + 1);
    }

    @BeforeEach
    void setUp() {
        bvh = new BoundingVolumeHierarchy<>(10);
    }

    @Test
    public void testInsertSingleVolume() {
        var volume = BoundingVolume.of(0, 0, 0, 1, 1, 1);
        bvh.insert(0, volume);

        assertEquals(List.of(0), bvh.query(volume));
        assertEquals(1, bvh.size());
        assertEquals(1, bvh.height());
        assertEquals(volume, bvh.getRootBounds().orElseThrow());
    }

    @Test
    public void testInsertThenRemove() {
        var volume = BoundingVolume.of(0, 0, 0, 1, 1, 1);
        bvh.insert(0, volume);
        bvh.insert(1, BoundingVolume.of(5, 5, 5, 6, 6, 6));

        bvh.remove(0);

        assertEquals(1, bvh.size());
        assertFalse(bvh.query(volume).contains(0));
        assertFalse(bvh.contains(0));
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testRemoveLastEntryEmptiesTree() {
        bvh.insert(0, BoundingVolume.of(0, 0, 0, 1, 1, 1));
        bvh.remove(0);

        assertEquals(0, bvh.size());
        assertTrue(bvh.isEmpty());
        assertEquals(0, bvh.height());
        assertTrue(bvh.getRootBounds().isEmpty());
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testQueryNoIntersection() {
        bvh.insert(0, BoundingVolume.of(0, 0, 0, 1, 1, 1));

        var results = new ArrayList<Integer>();
        assertEquals(0, bvh.query(BoundingVolume.of(10, 10, 10, 11, 11, 11), results));
        assertTrue(results.isEmpty());
    }

    @Test
    public void testQueryOverlappingVolumes() {
        bvh.insert(0, BoundingVolume.of(0, 0, 0, 1, 1, 1));
        bvh.insert(1, BoundingVolume.of(0.5f, 0.5f, 0.5f, 1.5f, 1.5f, 1.5f));

        var results = new ArrayList<Integer>();
        int found = bvh.query(BoundingVolume.of(0.25f, 0.25f, 0.25f, 1.25f, 1.25f, 1.25f), results);

        assertEquals(2, found);
        assertEquals(2, results.size());
        assertTrue(results.contains(0));
        assertTrue(results.contains(1));
    }

    @Test
    public void testQueryAppendsToCallerCollection() {
        bvh.insert(0, BoundingVolume.of(0, 0, 0, 1, 1, 1));
        var results = new ArrayList<Integer>(List.of(42));

        bvh.query(BoundingVolume.of(0, 0, 0, 1, 1, 1), results);

        assertEquals(List.of(42, 0), results);
    }

    @Test
    public void testQueryEmptyTree() {
        var results = new ArrayList<Integer>();
        assertEquals(0, bvh.query(BoundingVolume.of(0, 0, 0, 1, 1, 1), results));
        assertTrue(results.isEmpty());
    }

    @Test
    public void testReinsertReplacesEntry() {
        var volumeA = BoundingVolume.of(0, 0, 0, 1, 1, 1);
        var volumeB = BoundingVolume.of(2, 2, 2, 3, 3, 3);

        bvh.insert(1, volumeA);
        bvh.insert(1, volumeB);

        assertTrue(bvh.query(volumeA).isEmpty());
        assertEquals(List.of(1), bvh.query(volumeB));
        assertEquals(1, bvh.size());
        assertEquals(volumeB, bvh.getBounds(1).orElseThrow());
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testReinsertIntoLargerTreeReplacesEntry() {
        for (int i = 0; i < 20; i++) {
            bvh.insert(i, diagonal(i));
        }
        bvh.insert(7, diagonal(100));

        assertEquals(20, bvh.size());
        assertFalse(bvh.query(BoundingVolume.of(7.2f, 7.2f, 7.2f, 7.8f, 7.8f, 7.8f)).contains(7));
        assertEquals(List.of(7), bvh.query(BoundingVolume.of(100.2f, 100.2f, 100.2f, 100.8f, 100.8f, 100.8f)));
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testIdenticalVolumesPreserveAllKeys() {
        var volume = BoundingVolume.of(0, 0, 0, 1, 1, 1);
        bvh.insert(0, volume);
        bvh.insert(1, volume);

        var results = bvh.query(volume);
        assertEquals(2, results.size());
        assertTrue(results.containsAll(List.of(0, 1)));
    }

    @Test
    public void testUpdateEntryBoundsRelocates() {
        bvh.insert(0, BoundingVolume.of(0, 0, 0, 1, 1, 1));
        bvh.insert(1, BoundingVolume.of(2, 2, 2, 3, 3, 3));

        bvh.updateEntryBounds(0, BoundingVolume.of(1.5f, 1.5f, 1.5f, 2.5f, 2.5f, 2.5f));

        var results = bvh.query(BoundingVolume.of(2, 2, 2, 3, 3, 3));
        assertEquals(2, results.size());
        assertTrue(results.containsAll(List.of(0, 1)));
        assertTrue(bvh.query(BoundingVolume.of(0, 0, 0, 0.5f, 0.5f, 0.5f)).isEmpty());
        assertEquals(2, bvh.size());
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testUpdateWithSameBoundsIsNoOp() {
        var volume = BoundingVolume.of(0, 0, 0, 1, 1, 1);
        bvh.insert(0, volume);
        bvh.insert(1, diagonal(3));
        var before = bvh.getStatistics().arena().allocations();

        bvh.updateEntryBounds(0, BoundingVolume.of(0, 0, 0, 1, 1, 1));

        assertEquals(before, bvh.getStatistics().arena().allocations());
        assertEquals(volume, bvh.getBounds(0).orElseThrow());
    }

    @Test
    public void testUnknownKeyIsReported() {
        bvh.insert(0, BoundingVolume.of(0, 0, 0, 1, 1, 1));

        var removeFailure = assertThrows(KeyNotFoundException.class, () -> bvh.remove(99));
        assertEquals(99, removeFailure.getKey());
        assertThrows(KeyNotFoundException.class, () -> bvh.updateEntryBounds(99, diagonal(4)));
        assertFalse(bvh.tryRemove(99));

        assertEquals(1, bvh.size());
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testInvalidInputLeavesTreeUnchanged() {
        bvh.insert(0, BoundingVolume.of(0, 0, 0, 1, 1, 1));

        assertThrows(NullPointerException.class, () -> bvh.insert(null, diagonal(1)));
        assertThrows(NullPointerException.class, () -> bvh.insert(1, null));
        assertThrows(NullPointerException.class, () -> bvh.updateEntryBounds(0, null));
        assertThrows(NullPointerException.class, () -> bvh.query(null));
        assertThrows(IllegalArgumentException.class, () -> bvh.insert(1, BoundingVolume.of(1, 1, 1, 0, 0, 0)));

        assertEquals(1, bvh.size());
        assertEquals(BoundingVolume.of(0, 0, 0, 1, 1, 1), bvh.getBounds(0).orElseThrow());
    }

    @Test
    public void testClear() {
        var volume = BoundingVolume.of(0, 0, 0, 1, 1, 1);
        for (int i = 0; i < 100; i++) {
            bvh.insert(i, diagonal(i));
        }
        int capacity = bvh.getStatistics().arena().capacity();

        bvh.clear();

        assertEquals(0, bvh.size());
        assertTrue(bvh.query(volume).isEmpty());
        assertTrue(bvh.query(BoundingVolume.of(-1000, -1000, -1000, 1000, 1000, 1000)).isEmpty());
        assertEquals(capacity, bvh.getStatistics().arena().capacity());
        BVHValidator.assertValid(bvh);

        bvh.insert(5, volume);
        assertEquals(List.of(5), bvh.query(volume));
    }

    @Test
    public void testClearOnEmptyTreeIsNoOp() {
        bvh.clear();
        bvh.clear();
        assertEquals(0, bvh.size());
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testLargeNumberOfVolumes() {
        var tree = new BoundingVolumeHierarchy<Integer>(10000);
        var random = new Random(0x5eed);
        var boxes = new ArrayList<BoundingVolume>();
        for (int i = 0; i < 1000; i++) {
            var min = new Point3f(random.nextFloat() * 100, random.nextFloat() * 100, random.nextFloat() * 100);
            var max = new Point3f(min.x + random.nextFloat() * 10, min.y + random.nextFloat() * 10,
                                  min.z + random.nextFloat() * 10);
            var box = new BoundingVolume(min, max);
            boxes.add(box);
            tree.insert(i, box);
        }

        var query = BoundingVolume.of(50, 50, 50, 60, 60, 60);
        var expected = new HashSet<Integer>();
        for (int i = 0; i < boxes.size(); i++) {
            if (boxes.get(i).intersects(query)) {
                expected.add(i);
            }
        }
        var results = tree.query(query);

        assertFalse(results.isEmpty());
        assertEquals(expected.size(), results.size());
        assertEquals(expected, new HashSet<>(results));
    }

    @Test
    public void testGrowthFromTinyCapacity() {
        var tree = new BoundingVolumeHierarchy<Integer>(1);
        int count = 10000;
        for (int i = 0; i < count; i++) {
            tree.insert(i, diagonal(i));
        }

        var results = tree.query(BoundingVolume.of(0, 0, 0, count, count, count));
        assertEquals(count, results.size());
        assertEquals(count, new HashSet<>(results).size());
        BVHValidator.assertValid(tree);
    }

    @Test
    public void testRapidInsertionsAndDeletions() {
        for (int i = 0; i < 50; i++) {
            bvh.insert(i, diagonal(i));
        }
        for (int i = 0; i < 25; i++) {
            bvh.remove(i);
        }

        var results = bvh.query(BoundingVolume.of(0, 0, 0, 50, 50, 50));
        assertEquals(25, results.size());
        for (int i = 25; i < 50; i++) {
            assertTrue(results.contains(i));
        }
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testRemoveAllButRoot() {
        for (int i = 0; i < 50; i++) {
            bvh.insert(i, diagonal(i));
        }
        for (int i = 49; i >= 1; i--) {
            bvh.remove(i);
        }

        assertEquals(1, bvh.size());
        assertEquals(List.of(0), bvh.query(BoundingVolume.of(0, 0, 0, 50, 50, 50)));
        assertEquals(1, bvh.height());
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testRemoveAllEntries() {
        for (int i = 0; i < 50; i++) {
            bvh.insert(i, diagonal(i));
        }
        for (int i = 49; i >= 0; i--) {
            bvh.remove(i);
        }

        assertTrue(bvh.isEmpty());
        assertTrue(bvh.query(BoundingVolume.of(0, 0, 0, 50, 50, 50)).isEmpty());
        assertEquals(0, bvh.getStatistics().arena().allocated());
    }

    @Test
    public void testFreedSlotsAreReused() {
        for (int i = 0; i < 32; i++) {
            bvh.insert(i, diagonal(i));
        }
        int capacity = bvh.getStatistics().arena().capacity();
        for (int round = 0; round < 10; round++) {
            for (int i = 0; i < 32; i++) {
                bvh.updateEntryBounds(i, diagonal(i + round + 1));
            }
        }

        assertEquals(capacity, bvh.getStatistics().arena().capacity());
        assertTrue(bvh.getStatistics().arena().reuses() > 0);
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testRootBoundsEncloseAllEntries() {
        bvh.insert(0, BoundingVolume.of(-3, 0, 0, -2, 1, 1));
        bvh.insert(1, BoundingVolume.of(4, 5, 6, 7, 8, 9));
        bvh.insert(2, BoundingVolume.of(0, -9, 0, 1, 1, 1));

        assertEquals(BoundingVolume.of(-3, -9, 0, 7, 8, 9), bvh.getRootBounds().orElseThrow());
    }

    @Test
    public void testForEachIntersectingMayModifyTree() {
        for (int i = 0; i < 10; i++) {
            bvh.insert(i, diagonal(i));
        }

        bvh.forEachIntersecting(BoundingVolume.of(0, 0, 0, 4.5f, 4.5f, 4.5f), bvh::remove);

        assertEquals(5, bvh.size());
        for (int i = 0; i < 5; i++) {
            assertFalse(bvh.contains(i));
        }
        BVHValidator.assertValid(bvh);
    }

    @Test
    public void testStringKeys() {
        var tree = new BoundingVolumeHierarchy<String>();
        var keys = new ArrayList<String>();
        for (int i = 0; i < 100; i++) {
            var key = UUID.randomUUID().toString();
            keys.add(key);
            tree.insert(key, diagonal(i));
        }
        tree.remove(keys.get(10));

        assertEquals(99, tree.size());
        assertFalse(tree.contains(keys.get(10)));
        assertTrue(tree.contains(new String(keys.get(11))));
        BVHValidator.assertValid(tree);
    }

    @Test
    public void testStatistics() {
        for (int i = 0; i < 64; i++) {
            bvh.insert(i, diagonal(i));
        }
        var stats = bvh.getStatistics();

        assertEquals(64, stats.entries());
        assertEquals(63, stats.internalNodes());
        assertEquals(127, stats.totalNodes());
        assertEquals(127, stats.arena().allocated());
        assertEquals(bvh.height(), stats.height());
        assertTrue(stats.balanceRatio() >= 1.0);
    }

    @Test
    public void testEnsureCapacity() {
        bvh.ensureCapacity(1000);
        var capacity = bvh.getStatistics().arena().capacity();
        var growths = bvh.getStatistics().arena().growths();
        assertTrue(capacity >= 1999);

        for (int i = 0; i < 1000; i++) {
            bvh.insert(i, diagonal(i));
        }
        assertEquals(capacity, bvh.getStatistics().arena().capacity());
        assertEquals(growths, bvh.getStatistics().arena().growths());
    }
}
