/*
 * CellType.java
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
import java.util.Locale;

/**
 * Cell representation of a tile.
 */
@API(API.Status.EXPERIMENTAL)
public enum CellType {
    INT8(8, false),
    INT16(16, false),
    INT32(32, false),
    FLOAT32(32, true),
    FLOAT64(64, true);

    private final int bits;
    private final boolean floatingPoint;

    CellType(int bits, boolean floatingPoint) {
        this.bits = bits;
        this.floatingPoint = floatingPoint;
    }

    public int getBits() {
        return bits;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    @Nonnull
    public String getTypeName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
