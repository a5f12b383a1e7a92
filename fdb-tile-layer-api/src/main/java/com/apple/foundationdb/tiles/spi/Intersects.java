/*
 * Intersects.java
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
import com.apple.foundationdb.tiles.model.Extent;

import javax.annotation.Nonnull;

/**
 * Keeps the tiles whose extent intersects a query extent.
 */
@API(API.Status.EXPERIMENTAL)
public final class Intersects implements QueryConstraint {
    @Nonnull
    private final Extent extent;

    public Intersects(@Nonnull Extent extent) {
        this.extent = extent;
    }

    @Nonnull
    public Extent getExtent() {
        return extent;
    }

    @Override
    public <R> R accept(@Nonnull Visitor<R> visitor) {
        return visitor.visitIntersects(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Intersects)) {
            return false;
        }
        return extent.equals(((Intersects)o).extent);
    }

    @Override
    public int hashCode() {
        return extent.hashCode();
    }

    @Override
    public String toString() {
        return "Intersects(" + extent + ")";
    }
}
