/*
 * KeyTest.java
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

import java.time.Instant;

class KeyTest {

    @Test
    void spaceTimeKeyComponents() {
        Instant time = Instant.parse("2020-01-01T00:00:00Z");
        SpaceTimeKey key = SpaceTimeKey.of(2, 3, time);
        Assertions.assertThat(key.getSpatialKey()).isEqualTo(SpatialKey.of(2, 3));
        Assertions.assertThat(key.getTemporalKey()).isEqualTo(TemporalKey.of(time));
        Assertions.assertThat(key.getTemporalKey().getInstant()).isEqualTo(time.toEpochMilli());
        Assertions.assertThat(key).isEqualTo(SpaceTimeKey.of(2, 3, time.toEpochMilli()));
    }

    @Test
    void ordering() {
        Assertions.assertThat(SpatialKey.of(1, 0)).isLessThan(SpatialKey.of(0, 1));
        Assertions.assertThat(SpaceTimeKey.of(5, 5, 1L)).isLessThan(SpaceTimeKey.of(0, 0, 2L));
        Assertions.assertThat(LayerId.of("a", 9)).isLessThan(LayerId.of("b", 0));
        Assertions.assertThat(LayerId.of("a", 1)).isLessThan(LayerId.of("a", 2));
    }

    @Test
    void invalidLayerId() {
        Assertions.assertThatThrownBy(() -> LayerId.of("", 0)).isInstanceOf(IllegalArgumentException.class);
        Assertions.assertThatThrownBy(() -> LayerId.of("L1", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tiles() {
        ArrayTile tile = ArrayTile.of(2, 1, CellType.INT32, 1, 2);
        Assertions.assertThat(tile.getDouble(1, 0)).isEqualTo(2.0);
        Assertions.assertThat(tile.size()).isEqualTo(2);
        Assertions.assertThat(tile).isEqualTo(ArrayTile.of(2, 1, CellType.INT32, 1, 2))
                .isNotEqualTo(ArrayTile.fill(2, 1, CellType.INT32, 1));
        Assertions.assertThatThrownBy(() -> ArrayTile.of(2, 2, CellType.INT8, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
