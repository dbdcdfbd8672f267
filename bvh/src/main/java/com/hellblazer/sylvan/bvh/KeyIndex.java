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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps each live key to the arena index of its leaf, so removal and relocation by key never search the tree. Keys are
 * compared with {@code equals}/{@code hashCode}; no ordering is assumed.
 * <p>
 * Not thread safe; guarded by the owning hierarchy's lock.
 *
 * @param <T> the key type
 * @author hal.hildebrand
 */
public class KeyIndex<T> {
    public static final int NOT_FOUND = -1;

    private final Map<T, Integer> leaves;

    public KeyIndex(int expectedSize) {
        // HashMap resizes at 0.75 load
        this.leaves = new HashMap<>(Math.max(16, (int) (expectedSize / 0.75f) + 1));
    }

    public void clear() {
        leaves.clear();
    }

    public boolean contains(T key) {
        return leaves.containsKey(Objects.requireNonNull(key, "key cannot be null"));
    }

    /**
     * @return the leaf index for {@code key}, or {@link #NOT_FOUND}
     */
    public int indexOf(T key) {
        var index = leaves.get(Objects.requireNonNull(key, "key cannot be null"));
        return index == null ? NOT_FOUND : index;
    }

    /**
     * @return the leaf index that was registered for {@code key}, or {@link #NOT_FOUND}
     */
    public int remove(T key) {
        var index = leaves.remove(Objects.requireNonNull(key, "key cannot be null"));
        return index == null ? NOT_FOUND : index;
    }

    /**
     * Register {@code key} at {@code nodeIndex}, replacing any previous registration
     */
    public void set(T key, int nodeIndex) {
        if (nodeIndex < 0) {
            throw new IllegalArgumentException("Invalid node index " + nodeIndex + " for key " + key);
        }
        leaves.put(Objects.requireNonNull(key, "key cannot be null"), nodeIndex);
    }

    public int size() {
        return leaves.size();
    }
}
