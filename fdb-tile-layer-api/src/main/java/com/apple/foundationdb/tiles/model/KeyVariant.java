/*
 * KeyVariant.java
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
 * The shapes of key a layer can have. A layer's variant is derived once from the key class name in its
 * {@link LayerHeader} and determines both the relation's schema and how its scans extract key columns.
 */
@API(API.Status.EXPERIMENTAL)
public enum KeyVariant {
    /**
     * Keys are a grid position only ({@link SpatialKey}).
     */
    SPATIAL(SpatialKey.class, ImmutableSet.of(
            "SpatialKey",
            "geotrellis.spark.SpatialKey",
            "geotrellis.layer.SpatialKey",
            SpatialKey.class.getName())),

    /**
     * Keys are a grid position plus an instant ({@link SpaceTimeKey}).
     */
    SPACE_TIME(SpaceTimeKey.class, ImmutableSet.of(
            "SpaceTimeKey",
            "geotrellis.spark.SpaceTimeKey",
            "geotrellis.layer.SpaceTimeKey",
            SpaceTimeKey.class.getName()));

    @Nonnull
    private final Class<? extends SpatialComponent> keyClass;
    @Nonnull
    private final ImmutableSet<String> classNames;

    KeyVariant(@Nonnull Class<? extends SpatialComponent> keyClass, @Nonnull ImmutableSet<String> classNames) {
        this.keyClass = keyClass;
        this.classNames = classNames;
    }

    @Nonnull
    public Class<? extends SpatialComponent> getKeyClass() {
        return keyClass;
    }

    /**
     * The declared key class names that resolve to this variant.
     * @return the accepted class names
     */
    @Nonnull
    public ImmutableSet<String> getClassNames() {
        return classNames;
    }

    public boolean hasTemporalComponent() {
        return this == SPACE_TIME;
    }

    /**
     * Find the variant a declared key class name denotes. The spatial+temporal variant is checked first.
     *
     * @param className the key class name from a layer header
     * @return the matching variant, or {@code null} if the name denotes no known key representation
     */
    @Nullable
    public static KeyVariant forClassName(@Nonnull String className) {
        if (SPACE_TIME.classNames.contains(className)) {
            return SPACE_TIME;
        }
        if (SPATIAL.classNames.contains(className)) {
            return SPATIAL;
        }
        return null;
    }
}
