/*
 * TileLayout.java
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

import java.util.Objects;

/**
 * Shape of the tiling grid: how many tiles the layout has in each direction, and how many cells each tile has.
 */
@API(API.Status.EXPERIMENTAL)
public final class TileLayout {
    private final int layoutCols;
    private final int layoutRows;
    private final int tileCols;
    private final int tileRows;

    public TileLayout(int layoutCols, int layoutRows, int tileCols, int tileRows) {
        Preconditions.checkArgument(layoutCols > 0 && layoutRows > 0, "layout must have at least one tile");
        Preconditions.checkArgument(tileCols > 0 && tileRows > 0, "tiles must have at least one cell");
        this.layoutCols = layoutCols;
        this.layoutRows = layoutRows;
        this.tileCols = tileCols;
        this.tileRows = tileRows;
    }

    public int getLayoutCols() {
        return layoutCols;
    }

    public int getLayoutRows() {
        return layoutRows;
    }

    public int getTileCols() {
        return tileCols;
    }

    public int getTileRows() {
        return tileRows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TileLayout)) {
            return false;
        }
        final TileLayout that = (TileLayout)o;
        return layoutCols == that.layoutCols && layoutRows == that.layoutRows
               && tileCols == that.tileCols && tileRows == that.tileRows;
    }

    @Override
    public int hashCode() {
        return Objects.hash(layoutCols, layoutRows, tileCols, tileRows);
    }

    @Override
    public String toString() {
        return "TileLayout(" + layoutCols + ", " + layoutRows + ", " + tileCols + ", " + tileRows + ")";
    }
}
