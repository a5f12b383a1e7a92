/*
 * ValueVariant.java
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
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The value representations a layer can have. Only raster tiles are supported.
 */
@API(API.Status.EXPERIMENTAL)
public enum ValueVariant {
    TILE(Tile.class, ImmutableSet.of(
            "Tile",
            "ArrayTile",
            "geotrellis.raster.Tile",
            "geotrellis.raster.ArrayTile",
            Tile.class.getName(),
            ArrayTile.class.getName()));

    @Nonnull
    private final Class<?> valueClass;
    @Nonnull
    private final ImmutableSet<String> classNames;

    ValueVariant(@Nonnull Class<?> valueClass, @Nonnull ImmutableSet<String> classNames) {
        this.valueClass = valueClass;
        this.classNames = classNames;
    }

    @Nonnull
    public Class<?> getValueClass() {
        return valueClass;
    }

    @Nonnull
    public ImmutableSet<String> getClassNames() {
        return classNames;
    }

    /**
     * Find the variant a declared value class name denotes.
     *
     * @param className the value class name from a layer header
     * @return the matching variant, or {@code null} if the name denotes no supported value representation
     */
    @Nullable
    public static ValueVariant forClassName(@Nonnull String className) {
        for (ValueVariant variant : values()) {
            if (variant.classNames.contains(className)) {
                return variant;
            }
        }
        return null;
    }
}
