/*
 * AttributeStore.java
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
import com.apple.foundationdb.tiles.model.LayerHeader;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.SpatialComponent;
import com.apple.foundationdb.tiles.model.TileLayerMetadata;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Read-only access to the per-layer attributes of a store: the header and the layout metadata. Implementations
 * report a missing layer with a {@link com.apple.foundationdb.tiles.api.exceptions.LayerNotFoundException}.
 */
@API(API.Status.EXPERIMENTAL)
public interface AttributeStore {

    /**
     * Read the header of a layer.
     *
     * @param layerId the layer
     * @return the header the layer was written with
     */
    @Nonnull
    LayerHeader readHeader(@Nonnull LayerId layerId);

    /**
     * Read the layout metadata of a layer.
     *
     * @param layerId the layer
     * @param keyClass the key class the caller resolved from the layer's header
     * @param <K> the key type
     * @return the layout metadata
     */
    @Nonnull
    <K extends SpatialComponent> TileLayerMetadata<K> readMetadata(@Nonnull LayerId layerId, @Nonnull Class<K> keyClass);

    /**
     * List every layer in the store.
     *
     * @return the layer ids, in no particular order
     */
    @Nonnull
    List<LayerId> layerIds();

    boolean layerExists(@Nonnull LayerId layerId);
}
