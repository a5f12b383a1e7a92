/*
 * ExtentTest.java
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
import org.locationtech.jts.geom.Envelope;

class ExtentTest {

    @Test
    void sharedEdgeIntersects() {
        Extent left = new Extent(0, 0, 1, 1);
        Assertions.assertThat(left.intersects(new Extent(1, 0, 2, 1))).isTrue();
        Assertions.assertThat(left.intersects(new Extent(1.5, 0, 2, 1))).isFalse();
        Assertions.assertThat(left.contains(1, 1)).isTrue();
        Assertions.assertThat(left.contains(1.01, 1)).isFalse();
    }

    @Test
    void envelopeConversion() {
        Extent extent = Extent.fromEnvelope(new Envelope(3, 1, 4, 2));
        Assertions.assertThat(extent).isEqualTo(new Extent(1, 2, 3, 4));
        Assertions.assertThat(extent.toEnvelope()).isEqualTo(new Envelope(1, 3, 2, 4));
        Assertions.assertThat(extent.getWidth()).isEqualTo(2.0);
        Assertions.assertThat(extent.getHeight()).isEqualTo(2.0);
    }

    @Test
    void invalidBounds() {
        Assertions.assertThatThrownBy(() -> new Extent(1, 0, 0, 1)).isInstanceOf(IllegalArgumentException.class);
        Assertions.assertThatThrownBy(() -> Extent.fromEnvelope(new Envelope())).isInstanceOf(IllegalArgumentException.class);
    }
}
