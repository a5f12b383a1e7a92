/*
 * TileLayerMetadata.java
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
import java.util.Objects;

/**
 * Layout metadata of a layer. The key type parameter distinguishes the metadata of spatial layers
 * ({@code TileLayerMetadata<SpatialKey>}) from that of layers with a time dimension
 * ({@code TileLayerMetadata<SpaceTimeKey>}); both share the {@link MapKeyTransform} used to place keys.
 *
 * @param <K> the key type of the layer
 */
@API(API.Status.EXPERIMENTAL)
public final class TileLayerMetadata<K extends SpatialComponent> {
    @Nonnull
    private final CellType cellType;
    @Nonnull
    private final Extent layoutExtent;
    @Nonnull
    private final TileLayout tileLayout;
    @Nonnull
    private final Extent extent;
    @Nonnull
    private final String crs;
    @Nonnull
    private final KeyBounds<K> bounds;
    @Nonnull
    private final MapKeyTransform mapTransform;

    /**
     * Create layout metadata.
     *
     * @param cellType cell type of the layer's tiles
     * @param layoutExtent extent covered by the whole tiling grid
     * @param tileLayout shape of the tiling grid
     * @param extent extent actually covered by data, within the layout extent
     * @param crs name of the coordinate reference system, for example {@code EPSG:4326}
     * @param bounds smallest and largest key written
     */
    public TileLayerMetadata(@Nonnull CellType cellType,
                             @Nonnull Extent layoutExtent,
                             @Nonnull TileLayout tileLayout,
                             @Nonnull Extent extent,
                             @Nonnull String crs,
                             @Nonnull KeyBounds<K> bounds) {
        this.cellType = cellType;
        this.layoutExtent = layoutExtent;
        this.tileLayout = tileLayout;
        this.extent = extent;
        this.crs = crs;
        this.bounds = bounds;
        this.mapTransform = new MapKeyTransform(layoutExtent, tileLayout.getLayoutCols(), tileLayout.getLayoutRows());
    }

    @Nonnull
    public CellType getCellType() {
        return cellType;
    }

    @Nonnull
    public Extent getLayoutExtent() {
        return layoutExtent;
    }

    @Nonnull
    public TileLayout getTileLayout() {
        return tileLayout;
    }

    @Nonnull
    public Extent getExtent() {
        return extent;
    }

    @Nonnull
    public String getCrs() {
        return crs;
    }

    @Nonnull
    public KeyBounds<K> getBounds() {
        return bounds;
    }

    @Nonnull
    public MapKeyTransform getMapTransform() {
        return mapTransform;
    }

    @Nonnull
    public Extent keyToExtent(@Nonnull K key) {
        return mapTransform.keyToExtent(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TileLayerMetadata)) {
            return false;
        }
        final TileLayerMetadata<?> that = (TileLayerMetadata<?>)o;
        return cellType == that.cellType
               && layoutExtent.equals(that.layoutExtent)
               && tileLayout.equals(that.tileLayout)
               && extent.equals(that.extent)
               && crs.equals(that.crs)
               && bounds.equals(that.bounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellType, layoutExtent, tileLayout, extent, crs, bounds);
    }

    @Override
    public String toString() {
        return "TileLayerMetadata{cellType=" + cellType.getTypeName()
               + ", layoutExtent=" + layoutExtent
               + ", tileLayout=" + tileLayout
               + ", extent=" + extent
               + ", crs=" + crs
               + ", bounds=" + bounds + "}";
    }
}
