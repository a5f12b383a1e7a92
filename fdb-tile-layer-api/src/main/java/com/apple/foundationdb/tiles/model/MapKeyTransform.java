/*
 * MapKeyTransform.java
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

/**
 * Maps between grid keys and layer coordinates for a layout. Key {@code (0, 0)} is the upper left tile of the layout
 * extent; columns advance towards {@code xmax} and rows towards {@code ymin}.
 */
@API(API.Status.EXPERIMENTAL)
public final class MapKeyTransform {
    @Nonnull
    private final Extent extent;
    private final int layoutCols;
    private final int layoutRows;
    private final double tileWidth;
    private final double tileHeight;

    public MapKeyTransform(@Nonnull Extent extent, int layoutCols, int layoutRows) {
        this.extent = extent;
        this.layoutCols = layoutCols;
        this.layoutRows = layoutRows;
        this.tileWidth = extent.getWidth() / layoutCols;
        this.tileHeight = extent.getHeight() / layoutRows;
    }

    @Nonnull
    public Extent getExtent() {
        return extent;
    }

    public int getLayoutCols() {
        return layoutCols;
    }

    public int getLayoutRows() {
        return layoutRows;
    }

    /**
     * Compute the extent covered by the tile at the given key.
     *
     * @param key any layer key
     * @return the extent of the key's grid cell
     */
    @Nonnull
    public Extent keyToExtent(@Nonnull SpatialComponent key) {
        final SpatialKey spatialKey = key.getSpatialKey();
        return keyToExtent(spatialKey.getCol(), spatialKey.getRow());
    }

    @Nonnull
    public Extent keyToExtent(int col, int row) {
        return new Extent(
                extent.getXmin() + col * tileWidth,
                extent.getYmax() - (row + 1) * tileHeight,
                extent.getXmin() + (col + 1) * tileWidth,
                extent.getYmax() - row * tileHeight);
    }

    /**
     * Find the key whose grid cell contains a point. Points on a shared edge belong to the cell east (for x) or
     * south (for y) of that edge. The result may lie outside the layout if the point does.
     *
     * @param x x coordinate
     * @param y y coordinate
     * @return the key of the containing cell
     */
    @Nonnull
    public SpatialKey pointToKey(double x, double y) {
        final int col = (int)Math.floor((x - extent.getXmin()) / tileWidth);
        final int row = (int)Math.floor((extent.getYmax() - y) / tileHeight);
        return SpatialKey.of(col, row);
    }

    @Override
    public String toString() {
        return "MapKeyTransform(" + extent + ", " + layoutCols + ", " + layoutRows + ")";
    }
}
