/*
 * MapKeyTransformTest.java
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

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MapKeyTransformTest {
    // 4 x 2 grid of 10 x 10 cells over [-20, 0, 20, 20]
    private static final MapKeyTransform TRANSFORM = new MapKeyTransform(new Extent(-20, 0, 20, 20), 4, 2);

    @Test
    void keyToExtent() {
        Assertions.assertThat(TRANSFORM.keyToExtent(0, 0)).isEqualTo(new Extent(-20, 10, -10, 20));
        Assertions.assertThat(TRANSFORM.keyToExtent(SpatialKey.of(3, 1))).isEqualTo(new Extent(10, 0, 20, 10));
        Assertions.assertThat(TRANSFORM.keyToExtent(SpaceTimeKey.of(1, 1, 0L))).isEqualTo(new Extent(-10, 0, 0, 10));
    }

    @ParameterizedTest
    @CsvSource({
            "-15, 15, 0, 0",
            "-20, 20, 0, 0",
            "5, 5, 2, 1",
            "19.9, 0.1, 3, 1",
            "-10, 10, 1, 1",
    })
    void pointToKey(double x, double y, int col, int row) {
        Assertions.assertThat(TRANSFORM.pointToKey(x, y)).isEqualTo(SpatialKey.of(col, row));
    }

    @Test
    void pointOutsideLayout() {
        Assertions.assertThat(TRANSFORM.pointToKey(-25, 25)).isEqualTo(SpatialKey.of(-1, -1));
    }

    @Test
    void metadataUsesLayoutExtent() {
        TileLayerMetadata<SpatialKey> metadata = new TileLayerMetadata<>(CellType.FLOAT64,
                new Extent(0, 0, 2, 1), new TileLayout(2, 1, 256, 256), new Extent(0, 0, 1.5, 1), "EPSG:3857",
                new KeyBounds<>(SpatialKey.of(0, 0), SpatialKey.of(1, 0)));
        Assertions.assertThat(metadata.keyToExtent(SpatialKey.of(1, 0))).isEqualTo(new Extent(1, 0, 2, 1));
        Assertions.assertThat(metadata.getBounds().includesSpatially(SpatialKey.of(1, 0))).isTrue();
        Assertions.assertThat(metadata.getBounds().includesSpatially(SpaceTimeKey.of(2, 0, 0L))).isFalse();
        Assertions.assertThat(metadata.toString()).contains("cellType=float64", "crs=EPSG:3857");
    }
}
