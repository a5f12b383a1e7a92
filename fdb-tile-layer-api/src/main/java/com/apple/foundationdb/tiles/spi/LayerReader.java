/*
 * LayerReader.java
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
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.SpatialComponent;
import com.apple.foundationdb.tiles.model.ValueVariant;

import javax.annotation.Nonnull;

/**
 * Opens queries against the tiles of a store.
 */
@API(API.Status.EXPERIMENTAL)
public interface LayerReader {

    /**
     * Start a query over a whole layer. Nothing is read until the query is executed.
     *
     * @param layerId the layer
     * @param keyClass the key class of the layer
     * @param valueVariant the value representation of the layer
     * @param <K> the key type
     * @return an unconstrained query
     */
    @Nonnull
    <K extends SpatialComponent> LayerQuery<K> query(@Nonnull LayerId layerId, @Nonnull Class<K> keyClass, @Nonnull ValueVariant valueVariant);
}
