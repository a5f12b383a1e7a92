/*
 * SpaceTimeKey.java
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
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Key of a layer with a time dimension: a grid position plus an instant.
 */
@API(API.Status.EXPERIMENTAL)
public final class SpaceTimeKey implements SpatialComponent, Comparable<SpaceTimeKey> {
    private static final Comparator<SpaceTimeKey> ORDER = Comparator.comparing(SpaceTimeKey::getTemporalKey)
            .thenComparing(SpaceTimeKey::getSpatialKey);

    @Nonnull
    private final SpatialKey spatialKey;
    @Nonnull
    private final TemporalKey temporalKey;

    public SpaceTimeKey(@Nonnull SpatialKey spatialKey, @Nonnull TemporalKey temporalKey) {
        this.spatialKey = spatialKey;
        this.temporalKey = temporalKey;
    }

    @Nonnull
    public static SpaceTimeKey of(int col, int row, long instant) {
        return new SpaceTimeKey(SpatialKey.of(col, row), new TemporalKey(instant));
    }

    @Nonnull
    public static SpaceTimeKey of(int col, int row, @Nonnull Instant time) {
        return new SpaceTimeKey(SpatialKey.of(col, row), TemporalKey.of(time));
    }

    @Nonnull
    @Override
    public SpatialKey getSpatialKey() {
        return spatialKey;
    }

    @Nonnull
    public TemporalKey getTemporalKey() {
        return temporalKey;
    }

    @Override
    public int compareTo(@Nonnull SpaceTimeKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpaceTimeKey)) {
            return false;
        }
        final SpaceTimeKey that = (SpaceTimeKey)o;
        return spatialKey.equals(that.spatialKey) && temporalKey.equals(that.temporalKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spatialKey, temporalKey);
    }

    @Override
    public String toString() {
        return "SpaceTimeKey(" + spatialKey.getCol() + ", " + spatialKey.getRow() + ", " + temporalKey.getTime() + ")";
    }
}
