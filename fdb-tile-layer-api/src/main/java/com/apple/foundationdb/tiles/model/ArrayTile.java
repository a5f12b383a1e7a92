/*
 * ArrayTile.java
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
import java.util.Arrays;

/**
 * A {@link Tile} backed by a row-major array of cells.
 */
@API(API.Status.EXPERIMENTAL)
public final class ArrayTile implements Tile {
    private final int cols;
    private final int rows;
    @Nonnull
    private final CellType cellType;
    @Nonnull
    private final double[] cells;

    private ArrayTile(int cols, int rows, @Nonnull CellType cellType, @Nonnull double[] cells) {
        Preconditions.checkArgument(cols > 0 && rows > 0, "tile dimensions must be positive");
        Preconditions.checkArgument(cells.length == cols * rows,
                "expected %s cells for a %sx%s tile but got %s", cols * rows, cols, rows, cells.length);
        this.cols = cols;
        this.rows = rows;
        this.cellType = cellType;
        this.cells = cells;
    }

    @Nonnull
    public static ArrayTile of(int cols, int rows, @Nonnull CellType cellType, @Nonnull double... cells) {
        return new ArrayTile(cols, rows, cellType, cells.clone());
    }

    /**
     * Create a tile with every cell set to the same value.
     *
     * @param cols number of columns
     * @param rows number of rows
     * @param cellType cell representation
     * @param value the value of every cell
     * @return the new tile
     */
    @Nonnull
    public static ArrayTile fill(int cols, int rows, @Nonnull CellType cellType, double value) {
        final double[] cells = new double[cols * rows];
        Arrays.fill(cells, value);
        return new ArrayTile(cols, rows, cellType, cells);
    }

    @Override
    public int getCols() {
        return cols;
    }

    @Override
    public int getRows() {
        return rows;
    }

    @Nonnull
    @Override
    public CellType getCellType() {
        return cellType;
    }

    @Override
    public double getDouble(int col, int row) {
        Preconditions.checkElementIndex(col, cols, "col");
        Preconditions.checkElementIndex(row, rows, "row");
        return cells[row * cols + col];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArrayTile)) {
            return false;
        }
        final ArrayTile that = (ArrayTile)o;
        return cols == that.cols && rows == that.rows && cellType == that.cellType && Arrays.equals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * cols + rows) + cellType.hashCode()) + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "ArrayTile(" + cols + "x" + rows + ", " + cellType.getTypeName() + ")";
    }
}
