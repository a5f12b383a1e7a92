/*
 * InMemoryLayerStore.java
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

package com.apple.foundationdb.tiles.memory;

import com.apple.foundationdb.annotation.API;
import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.api.exceptions.LayerNotFoundException;
import com.apple.foundationdb.tiles.api.exceptions.TileLayerException;
import com.apple.foundationdb.tiles.logging.KeyValueLogMessage;
import com.apple.foundationdb.tiles.model.LayerHeader;
import com.apple.foundationdb.tiles.model.LayerId;
import com.apple.foundationdb.tiles.model.SpatialComponent;
import com.apple.foundationdb.tiles.model.Tile;
import com.apple.foundationdb.tiles.model.TileLayerMetadata;
import com.apple.foundationdb.tiles.model.ValueVariant;
import com.apple.foundationdb.tiles.spi.LayerQuery;
import com.apple.foundationdb.tiles.spi.LayerStore;
import com.apple.foundationdb.tiles.util.LogMessageKeys;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A {@link LayerStore} that keeps its layers in memory.
 *
 * <p>
 * Named stores are registered globally, so that a relation can open them by location ({@code memory:<name>}, see
 * {@link InMemoryLayerStoreProvider}). A layer is written whole: its header, its layout metadata and all of its
 * tiles. Writing a layer id that already exists fails unless {@link #overwriteLayer} is used. Queries read the
 * tiles of the layer as they were when the query was executed, in key order.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class InMemoryLayerStore implements LayerStore {
    public static final String SCHEME = "memory";
    public static final String FORMAT = "memory";

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryLayerStore.class);
    private static final ConcurrentMap<String, InMemoryLayerStore> STORES = new ConcurrentHashMap<>();

    @Nonnull
    private final String name;
    @Nonnull
    private final ConcurrentMap<LayerId, StoredLayer<?>> layers = new ConcurrentHashMap<>();

    public InMemoryLayerStore(@Nonnull String name) {
        Preconditions.checkArgument(!name.isEmpty(), "store name must not be empty");
        this.name = name;
    }

    /**
     * Get the registered store with the given name, registering a new empty one if there is none.
     *
     * @param name the store name
     * @return the store
     */
    @Nonnull
    public static InMemoryLayerStore named(@Nonnull String name) {
        return STORES.computeIfAbsent(name, InMemoryLayerStore::new);
    }

    @Nullable
    public static InMemoryLayerStore lookup(@Nonnull String name) {
        return STORES.get(name);
    }

    public static boolean drop(@Nonnull String name) {
        return STORES.remove(name) != null;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public URI getLocation() {
        return URI.create(SCHEME + ":" + name);
    }

    /**
     * Write a new layer with a header naming {@code keyClass} and {@link Tile}.
     *
     * @param layerId the layer
     * @param keyClass the key class
     * @param metadata the layout metadata
     * @param tiles the tiles
     * @param <K> the key type
     * @throws TileLayerException if the layer already exists or a key lies outside the metadata's key bounds
     */
    public <K extends SpatialComponent> void writeLayer(@Nonnull LayerId layerId, @Nonnull Class<K> keyClass,
                                                        @Nonnull TileLayerMetadata<K> metadata,
                                                        @Nonnull Map<K, ? extends Tile> tiles) {
        writeLayer(layerId, new LayerHeader(keyClass.getName(), Tile.class.getName(), FORMAT), keyClass, metadata, tiles);
    }

    /**
     * Write a new layer with an explicit header. The header is returned as is by {@link #readHeader(LayerId)}, even
     * if it names types the relation cannot read.
     *
     * @param layerId the layer
     * @param header the header
     * @param keyClass the key class the tiles are stored under
     * @param metadata the layout metadata
     * @param tiles the tiles
     * @param <K> the key type
     * @throws TileLayerException if the layer already exists or a key lies outside the metadata's key bounds
     */
    public <K extends SpatialComponent> void writeLayer(@Nonnull LayerId layerId, @Nonnull LayerHeader header,
                                                        @Nonnull Class<K> keyClass,
                                                        @Nonnull TileLayerMetadata<K> metadata,
                                                        @Nonnull Map<K, ? extends Tile> tiles) {
        final StoredLayer<K> layer = StoredLayer.of(layerId, header, keyClass, metadata, tiles);
        if (layers.putIfAbsent(layerId, layer) != null) {
            throw new TileLayerException("Layer already exists", ErrorCode.INVALID_PARAMETER,
                    LogMessageKeys.STORE_NAME, name,
                    LogMessageKeys.LAYER_NAME, layerId.getName(),
                    LogMessageKeys.LAYER_ZOOM, layerId.getZoom());
        }
        logWrite("wrote layer", layer);
    }

    /**
     * Write a layer, replacing all of its previous header, metadata and tiles if it exists.
     *
     * @param layerId the layer
     * @param header the header
     * @param keyClass the key class the tiles are stored under
     * @param metadata the layout metadata
     * @param tiles the tiles
     * @param <K> the key type
     */
    public <K extends SpatialComponent> void overwriteLayer(@Nonnull LayerId layerId, @Nonnull LayerHeader header,
                                                            @Nonnull Class<K> keyClass,
                                                            @Nonnull TileLayerMetadata<K> metadata,
                                                            @Nonnull Map<K, ? extends Tile> tiles) {
        final StoredLayer<K> layer = StoredLayer.of(layerId, header, keyClass, metadata, tiles);
        layers.put(layerId, layer);
        logWrite("overwrote layer", layer);
    }

    public boolean deleteLayer(@Nonnull LayerId layerId) {
        return layers.remove(layerId) != null;
    }

    @Nonnull
    @Override
    public LayerHeader readHeader(@Nonnull LayerId layerId) {
        return getLayer(layerId).getHeader();
    }

    @Nonnull
    @Override
    public <K extends SpatialComponent> TileLayerMetadata<K> readMetadata(@Nonnull LayerId layerId, @Nonnull Class<K> keyClass) {
        return getLayer(layerId, keyClass).getMetadata();
    }

    @Nonnull
    @Override
    public List<LayerId> layerIds() {
        return ImmutableList.copyOf(layers.keySet());
    }

    @Override
    public boolean layerExists(@Nonnull LayerId layerId) {
        return layers.containsKey(layerId);
    }

    @Nonnull
    @Override
    public <K extends SpatialComponent> LayerQuery<K> query(@Nonnull LayerId layerId, @Nonnull Class<K> keyClass,
                                                           @Nonnull ValueVariant valueVariant) {
        Preconditions.checkArgument(valueVariant.getValueClass().isAssignableFrom(Tile.class),
                "in-memory layers hold tiles, not %s", valueVariant);
        getLayer(layerId, keyClass);
        return new InMemoryLayerQuery<>(this, layerId, keyClass, ImmutableList.of());
    }

    @Nonnull
    StoredLayer<?> getLayer(@Nonnull LayerId layerId) {
        final StoredLayer<?> layer = layers.get(layerId);
        if (layer == null) {
            throw new LayerNotFoundException("Layer not found: " + layerId, ErrorCode.LAYER_NOT_FOUND,
                    LogMessageKeys.STORE_NAME, name,
                    LogMessageKeys.LAYER_NAME, layerId.getName(),
                    LogMessageKeys.LAYER_ZOOM, layerId.getZoom());
        }
        return layer;
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    <K extends SpatialComponent> StoredLayer<K> getLayer(@Nonnull LayerId layerId, @Nonnull Class<K> keyClass) {
        final StoredLayer<?> layer = getLayer(layerId);
        if (!layer.getKeyClass().equals(keyClass)) {
            throw new TileLayerException("Layer is keyed by a different key class", ErrorCode.INVALID_TYPE,
                    LogMessageKeys.STORE_NAME, name,
                    LogMessageKeys.LAYER_NAME, layerId.getName(),
                    LogMessageKeys.LAYER_ZOOM, layerId.getZoom(),
                    LogMessageKeys.KEY_CLASS, layer.getKeyClass().getName(),
                    LogMessageKeys.EXPECTED_TYPE, keyClass.getName());
        }
        return (StoredLayer<K>)layer;
    }

    private void logWrite(@Nonnull String title, @Nonnull StoredLayer<?> layer) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of(title,
                    LogMessageKeys.STORE_NAME, name,
                    LogMessageKeys.LAYER_NAME, layer.getLayerId().getName(),
                    LogMessageKeys.LAYER_ZOOM, layer.getLayerId().getZoom(),
                    LogMessageKeys.KEY_CLASS, layer.getHeader().getKeyClassName(),
                    LogMessageKeys.VALUE_CLASS, layer.getHeader().getValueClassName()));
        }
    }

    @Override
    public String toString() {
        return "InMemoryLayerStore(" + name + ")";
    }

    /**
     * One layer as written.
     *
     * @param <K> the key type
     */
    static final class StoredLayer<K extends SpatialComponent> {
        @Nonnull
        private final LayerId layerId;
        @Nonnull
        private final LayerHeader header;
        @Nonnull
        private final Class<K> keyClass;
        @Nonnull
        private final TileLayerMetadata<K> metadata;
        @Nonnull
        private final ImmutableSortedMap<K, Tile> tiles;

        private StoredLayer(@Nonnull LayerId layerId, @Nonnull LayerHeader header, @Nonnull Class<K> keyClass,
                            @Nonnull TileLayerMetadata<K> metadata, @Nonnull ImmutableSortedMap<K, Tile> tiles) {
            this.layerId = layerId;
            this.header = header;
            this.keyClass = keyClass;
            this.metadata = metadata;
            this.tiles = tiles;
        }

        @Nonnull
        static <K extends SpatialComponent> StoredLayer<K> of(@Nonnull LayerId layerId, @Nonnull LayerHeader header,
                                                              @Nonnull Class<K> keyClass,
                                                              @Nonnull TileLayerMetadata<K> metadata,
                                                              @Nonnull Map<K, ? extends Tile> tiles) {
            Preconditions.checkArgument(Comparable.class.isAssignableFrom(keyClass),
                    "key class %s is not comparable", keyClass.getName());
            for (K key : tiles.keySet()) {
                if (!metadata.getBounds().includesSpatially(key)) {
                    throw new TileLayerException("Key outside of layer bounds", ErrorCode.INVALID_PARAMETER,
                            LogMessageKeys.LAYER_NAME, layerId.getName(),
                            LogMessageKeys.LAYER_ZOOM, layerId.getZoom(),
                            LogMessageKeys.TILE_KEY, key,
                            LogMessageKeys.CONSTRAINT, metadata.getBounds());
                }
            }
            return new StoredLayer<>(layerId, header, keyClass, metadata, ImmutableSortedMap.copyOf(tiles));
        }

        @Nonnull
        LayerId getLayerId() {
            return layerId;
        }

        @Nonnull
        LayerHeader getHeader() {
            return header;
        }

        @Nonnull
        Class<K> getKeyClass() {
            return keyClass;
        }

        @Nonnull
        TileLayerMetadata<K> getMetadata() {
            return metadata;
        }

        @Nonnull
        ImmutableSortedMap<K, Tile> getTiles() {
            return tiles;
        }
    }
}
