/*
 * SpatialKey.java
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
import java.util.Comparator;

/**
 * Grid position of a tile in a layout. Columns grow to the east, rows grow to the south.
 */
@API(API.Status.EXPERIMENTAL)
public final class SpatialKey implements SpatialComponent, Comparable<SpatialKey> {
    private static final Comparator<SpatialKey> ORDER = Comparator.comparingInt(SpatialKey::getRow).thenComparingInt(SpatialKey::getCol);

    private final int col;
    private final int row;

    public SpatialKey(int col, int row) {
        this.col = col;
        this.row = row;
    }

    @Nonnull
    public static SpatialKey of(int col, int row) {
        return new SpatialKey(col, row);
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    @Nonnull
    @Override
    public SpatialKey getSpatialKey() {
        return this;
    }

    @Override
    public int compareTo(@Nonnull SpatialKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpatialKey)) {
            return false;
        }
        final SpatialKey that = (SpatialKey)o;
        return col == that.col && row == that.row;
    }

    @Override
    public int hashCode() {
        return 31 * col + row;
    }

    @Override
    public String toString() {
        return "SpatialKey(" + col + ", " + row + ")";
    }
}
