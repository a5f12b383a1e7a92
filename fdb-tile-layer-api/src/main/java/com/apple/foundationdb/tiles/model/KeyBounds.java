/*
 * KeyBounds.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2025 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.apple.foundationdb.tiles.model;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Smallest and largest key written to a layer.
 *
 * @param <K> the key type of the layer
 */
@API(API.Status.EXPERIMENTAL)
public final class KeyBounds<K extends SpatialComponent> {
    @Nonnull
    private final K minKey;
    @Nonnull
    private final K maxKey;

    public KeyBounds(@Nonnull K minKey, @Nonnull K maxKey) {
        this.minKey = minKey;
        this.maxKey = maxKey;
    }

    @Nonnull
    public K getMinKey() {
        return minKey;
    }

    @Nonnull
    public K getMaxKey() {
        return maxKey;
    }

    /**
     * Whether the grid position of a key falls within the columns and rows spanned by these bounds.
     *
     * @param key the key to test
     * @return {@code true} if the key's grid position is inside the bounds
     */
    public boolean includesSpatially(@Nonnull SpatialComponent key) {
        final SpatialKey min = minKey.getSpatialKey();
        final SpatialKey max = maxKey.getSpatialKey();
        final SpatialKey spatialKey = key.getSpatialKey();
        return spatialKey.getCol() >= min.getCol() && spatialKey.getCol() <= max.getCol()
               && spatialKey.getRow() >= min.getRow() && spatialKey.getRow() <= max.getRow();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyBounds)) {
            return false;
        }
        final KeyBounds<?> that = (KeyBounds<?>)o;
        return minKey.equals(that.minKey) && maxKey.equals(that.maxKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minKey, maxKey);
    }

    @Override
    public String toString() {
        return "KeyBounds(" + minKey + ", " + maxKey + ")";
    }
}
