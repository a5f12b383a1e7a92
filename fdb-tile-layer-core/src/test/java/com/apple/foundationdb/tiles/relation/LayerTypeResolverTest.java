/*
 * LayerTypeResolverTest.java
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

package com.apple.foundationdb.tiles.relation;

import com.apple.foundationdb.tiles.api.exceptions.ErrorCode;
import com.apple.foundationdb.tiles.model.KeyVariant;
import com.apple.foundationdb.tiles.model.LayerHeader;
import com.apple.foundationdb.tiles.model.ValueVariant;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.apple.foundationdb.tiles.TileLayerAssertions.assertThrowsTileLayerException;

class LayerTypeResolverTest {

    @ParameterizedTest
    @CsvSource({
            "SpatialKey, Tile, SPATIAL",
            "geotrellis.spark.SpatialKey, geotrellis.raster.Tile, SPATIAL",
            "com.apple.foundationdb.tiles.model.SpatialKey, com.apple.foundationdb.tiles.model.ArrayTile, SPATIAL",
            "SpaceTimeKey, Tile, SPACE_TIME",
            "geotrellis.spark.SpaceTimeKey, geotrellis.raster.ArrayTile, SPACE_TIME",
    })
    void resolves(String keyClass, String valueClass, KeyVariant expected) {
        ResolvedLayerType type = LayerTypeResolver.resolve(new LayerHeader(keyClass, valueClass));
        Assertions.assertThat(type.getKeyVariant()).isEqualTo(expected);
        Assertions.assertThat(type.getValueVariant()).isEqualTo(ValueVariant.TILE);
    }

    @Test
    void unknownKey() {
        assertThrowsTileLayerException(() -> LayerTypeResolver.resolve(new LayerHeader("GridKey", "Tile")),
                ErrorCode.UNSUPPORTED_KEY_TYPE)
                .hasLogInfo("key_class", "GridKey");
    }

    @Test
    void unknownValue() {
        assertThrowsTileLayerException(() -> LayerTypeResolver.resolve(new LayerHeader("SpaceTimeKey", "MultibandTile")),
                ErrorCode.UNSUPPORTED_VALUE_TYPE)
                .hasMessage("Unsupported tile type MultibandTile");
    }

    @Test
    void keyIsCheckedFirst() {
        assertThrowsTileLayerException(() -> LayerTypeResolver.resolve(new LayerHeader("GridKey", "MultibandTile")),
                ErrorCode.UNSUPPORTED_KEY_TYPE);
    }
}
