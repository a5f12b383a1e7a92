/*
 * LayerEntry.java
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

package com.apple.foundationdb.tiles.spi;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.tiles.model.SpatialComponent;
import com.apple.foundationdb.tiles.model.Tile;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A key and the tile stored under it. A reader may return a {@code null} tile for a key that has no data.
 *
 * @param <K> the key type
 */
@API(API.Status.EXPERIMENTAL)
public final class LayerEntry<K extends SpatialComponent> {
    @Nonnull
    private final K key;
    @Nullable
    private final Tile tile;

    public LayerEntry(@Nonnull K key, @Nullable Tile tile) {
        this.key = key;
        this.tile = tile;
    }

    @Nonnull
    public K getKey() {
        return key;
    }

    @Nullable
    public Tile getTile() {
        return tile;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LayerEntry)) {
            return false;
        }
        final LayerEntry<?> that = (LayerEntry<?>)o;
        return key.equals(that.key) && Objects.equals(tile, that.tile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, tile);
    }

    @Override
    public String toString() {
        return key + " -> " + tile;
    }
}
