/*
 * Tile.java
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
 * A raster tile. The relation never looks inside a tile; it hands tiles to the consumer exactly as the store
 * returned them.
 */
@API(API.Status.EXPERIMENTAL)
public interface Tile {
    int getCols();

    int getRows();

    @Nonnull
    CellType getCellType();

    /**
     * Read one cell.
     *
     * @param col cell column, {@code 0 <= col < getCols()}
     * @param row cell row, {@code 0 <= row < getRows()}
     * @return the cell value, or {@link Double#NaN} for a no-data cell
     */
    double getDouble(int col, int row);

    default int size() {
        return getCols() * getRows();
    }
}
