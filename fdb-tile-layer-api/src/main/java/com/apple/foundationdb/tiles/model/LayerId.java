/*
 * LayerId.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one layer in a store: a layer name together with its zoom level.
 */
@API(API.Status.EXPERIMENTAL)
public final class LayerId implements Comparable<LayerId> {
    private static final Comparator<LayerId> ORDER = Comparator.comparing(LayerId::getName).thenComparingInt(LayerId::getZoom);

    @Nonnull
    private final String name;
    private final int zoom;

    public LayerId(@Nonnull String name, int zoom) {
        Preconditions.checkArgument(!name.isEmpty(), "layer name must not be empty");
        Preconditions.checkArgument(zoom >= 0, "layer zoom must not be negative");
        this.name = name;
        this.zoom = zoom;
    }

    @Nonnull
    public static LayerId of(@Nonnull String name, int zoom) {
        return new LayerId(name, zoom);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public int getZoom() {
        return zoom;
    }

    @Override
    public int compareTo(@Nonnull LayerId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LayerId)) {
            return false;
        }
        final LayerId layerId = (LayerId)o;
        return zoom == layerId.zoom && name.equals(layerId.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, zoom);
    }

    @Override
    public String toString() {
        return "LayerId(" + name + ", " + zoom + ")";
    }
}
